package com.nestplan.schema;

import java.util.Objects;

/**
 * A relationship declared by an entity schema.
 *
 * <p>Joining an association from a binding of the owner entity produces the condition
 * {@code related.relatedKey == owner.ownerKey}.
 *
 * <ul>
 *   <li>has_many / has_one: owner key is the owner's primary key, related key is the
 *       foreign key on the related entity</li>
 *   <li>belongs_to: owner key is the foreign key on the owner, related key is the
 *       related entity's primary key</li>
 * </ul>
 *
 * @param name the association name
 * @param cardinality the relationship kind
 * @param owner the entity declaring the association
 * @param related the associated entity
 * @param ownerKey the key field on the owner
 * @param relatedKey the key field on the related entity
 */
public record Association(String name, Cardinality cardinality, String owner, String related,
                          String ownerKey, String relatedKey) {

    /**
     * Relationship kinds.
     */
    public enum Cardinality {
        HAS_ONE,
        HAS_MANY,
        BELONGS_TO
    }

    public Association {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(cardinality, "cardinality must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(related, "related must not be null");
        Objects.requireNonNull(ownerKey, "ownerKey must not be null");
        Objects.requireNonNull(relatedKey, "relatedKey must not be null");
    }
}
