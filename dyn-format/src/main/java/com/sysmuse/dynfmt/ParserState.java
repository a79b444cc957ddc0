package com.sysmuse.dynfmt;

/**
 * States of the template scanner.
 * LITERAL: copying text through to the sink.
 * SPEC_POSITION, SPEC_WIDTH, SPEC_PRECISION: inside a placeholder, capturing the sub-field
 * in front of ':' and '.' respectively.
 */
enum ParserState {
    LITERAL,
    SPEC_POSITION,
    SPEC_WIDTH,
    SPEC_PRECISION;

    boolean isSpec() {
        return this != LITERAL;
    }
}
