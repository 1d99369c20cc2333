package com.nestplan.expression;

import com.nestplan.types.TypeCaster;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expression embedding adapter-specific text with {@code ?} placeholders for its
 * arguments ({@code fragment("? + ?", &0.id, &0.id)}).
 *
 * <p>Fragments are opaque to the planner: their result type is unknown and they
 * cannot be selected by a subquery.
 */
public final class Fragment implements Expression {

    private final String template;
    private final List<Expression> arguments;

    public Fragment(String template, List<Expression> arguments) {
        this.template = Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        this.arguments = List.copyOf(arguments);
    }

    public static Fragment of(String template, Expression... arguments) {
        return new Fragment(template, List.of(arguments));
    }

    public String template() {
        return template;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new Fragment(template, new ArrayList<>(children));
    }

    @Override
    public String render(RenderContext context) {
        StringBuilder sb = new StringBuilder("fragment(").append(TypeCaster.inspect(template));
        for (Expression argument : arguments) {
            sb.append(", ").append(argument.render(context));
        }
        return sb.append(")").toString();
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Fragment)) return false;
        Fragment that = (Fragment) obj;
        return template.equals(that.template) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, arguments);
    }
}
