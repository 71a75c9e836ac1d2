package com.roundpilot.core.layout;

/**
 * Offset of one named window position inside a screen layout.
 */
public record PositionOffset(int left, int top) {

    public static final PositionOffset ORIGIN = new PositionOffset(0, 0);
}
