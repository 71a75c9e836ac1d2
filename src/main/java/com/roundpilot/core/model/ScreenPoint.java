package com.roundpilot.core.model;

/**
 * A single click target on the screen.
 */
public record ScreenPoint(int x, int y) {

    public ScreenPoint offsetBy(int dx, int dy) {
        return new ScreenPoint(x + dx, y + dy);
    }
}
