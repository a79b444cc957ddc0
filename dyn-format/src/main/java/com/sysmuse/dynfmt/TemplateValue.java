package com.sysmuse.dynfmt;

/**
 * A value that can be substituted into a template placeholder.
 *
 * Implementations produce their own native text; DynamicFormatter only pads the result
 * to the placeholder width. Use {@link com.sysmuse.dynfmt.value.TemplateValues#of(Object)}
 * to adapt plain Java objects.
 */
public interface TemplateValue {

    /** Marker for "no precision given". */
    int NO_PRECISION = -1;

    /**
     * Returns the text form of this value.
     *
     * @param precision precision from the placeholder, or {@link #NO_PRECISION};
     *                  types without a notion of precision ignore it
     */
    String toText(int precision);

    /**
     * Numeric values keep a leading sign in front of zero padding ({@code -0042}).
     */
    default boolean isNumeric() {
        return false;
    }
}
