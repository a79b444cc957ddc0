package com.sysmuse.dynfmt;

/**
 * Defines what DynamicFormatter writes when the template ends inside a placeholder
 * that was never closed, e.g. {@code "total: {1:4"}.
 */
public enum UnterminatedPlaceholderMode {
    /**
     * Write the text captured after the opening brace as trailing literal text.
     * The brace itself is dropped, same as a lone trailing '{'.
     */
    LITERAL,

    /**
     * Write nothing for the unterminated placeholder.
     */
    DROP
}
