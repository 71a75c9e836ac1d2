package com.roundpilot.core.screen;

import java.awt.image.BufferedImage;

/**
 * Turns a captured region into text. The recognition engine is pluggable.
 */
@FunctionalInterface
public interface TextRecognizer {

    String recognize(BufferedImage image);
}
