package com.nestplan.expression;

/**
 * Resolves source positions and parameter placeholders while rendering expressions.
 */
public interface RenderContext {

    /** Renders sources as {@code &ix} and placeholders as {@code ^ix}. */
    RenderContext POSITIONAL = new RenderContext() {
        @Override
        public String source(int index) {
            return "&" + index;
        }

        @Override
        public String parameter(int index) {
            return "^" + index;
        }
    };

    String source(int index);

    String parameter(int index);
}
