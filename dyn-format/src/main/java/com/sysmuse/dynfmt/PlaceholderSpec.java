package com.sysmuse.dynfmt;

/**
 * Raw sub-field ranges of the placeholder currently being scanned, as [start, end) offsets
 * into the template. One instance is reused for every placeholder of a render.
 */
final class PlaceholderSpec {

    private int openOffset;
    private int positionStart;
    private int positionEnd;
    private int widthStart;
    private int widthEnd;
    private int precisionStart;
    private int precisionEnd;

    /**
     * Start a new placeholder whose content begins at {@code offset} (just past the '{').
     */
    void reset(int offset) {
        openOffset = offset;
        positionStart = positionEnd = offset;
        widthStart = widthEnd = offset;
        precisionStart = precisionEnd = offset;
    }

    void beginWidth(int offset) {
        widthStart = widthEnd = offset;
    }

    void beginPrecision(int offset) {
        precisionStart = precisionEnd = offset;
    }

    /**
     * Grow the sub-field that belongs to {@code state} by one char.
     */
    void extend(ParserState state) {
        switch (state) {
            case SPEC_POSITION:
                positionEnd++;
                break;
            case SPEC_WIDTH:
                widthEnd++;
                break;
            case SPEC_PRECISION:
                precisionEnd++;
                break;
            default:
                throw new IllegalStateException("Not inside a placeholder: " + state);
        }
    }

    int getOpenOffset() {
        return openOffset;
    }

    int getPositionStart() {
        return positionStart;
    }

    int getPositionEnd() {
        return positionEnd;
    }

    int getWidthStart() {
        return widthStart;
    }

    int getWidthEnd() {
        return widthEnd;
    }

    int getPrecisionStart() {
        return precisionStart;
    }

    int getPrecisionEnd() {
        return precisionEnd;
    }
}
