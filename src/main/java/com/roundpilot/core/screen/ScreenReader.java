package com.roundpilot.core.screen;

import com.roundpilot.core.model.ColorSample;
import com.roundpilot.core.model.Region;

/**
 * Capture and recognition capability for rectangular screen regions.
 * <p>
 * Implementations must be safe to call from several source worker threads at high
 * frequency. Every method may fail with {@link ReadException}.
 */
public interface ScreenReader {

    /**
     * Mean color of the region.
     */
    ColorSample sampleColor(Region region);

    /**
     * Raw recognized text of the region, unparsed.
     */
    String readText(Region region);

    /**
     * Numeric value shown in the region, parsed with {@link ReadingParser#parseNumber(String)}.
     */
    default double readNumber(Region region) {
        return ReadingParser.parseNumber(readText(region));
    }
}
