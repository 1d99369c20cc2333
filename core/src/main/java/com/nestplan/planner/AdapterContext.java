package com.nestplan.planner;

import com.nestplan.types.CastResult;
import com.nestplan.types.DataType;
import com.nestplan.types.TypeCaster;

/**
 * The storage adapter the compiled plan is handed to.
 *
 * <p>The planner only needs the adapter to turn cast values into the representation
 * the adapter binds; execution is out of the planner's hands.
 */
public interface AdapterContext {

    /**
     * Returns the adapter name, used in logs.
     *
     * @return the adapter name
     */
    String name();

    /**
     * Dumps a cast value into the adapter representation.
     *
     * @param type the type the value was cast to
     * @param value the cast value (may be null)
     * @return the dumped value, or an error result
     */
    default CastResult dump(DataType type, Object value) {
        return TypeCaster.dump(type, value);
    }
}
