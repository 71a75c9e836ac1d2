package com.roundpilot.core.model;

/**
 * Integer pixel rectangle on the screen.
 *
 * @param left   x of the top-left corner
 * @param top    y of the top-left corner
 * @param width  width in pixels
 * @param height height in pixels
 */
public record Region(int left, int top, int width, int height) {

    public Region {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Region must have positive size, got " + width + "x" + height);
        }
    }

    /**
     * Returns a copy moved by the given offset; size is unchanged.
     */
    public Region offsetBy(int dx, int dy) {
        return new Region(left + dx, top + dy, width, height);
    }
}
