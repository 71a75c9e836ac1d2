package com.roundpilot.core.model;

/**
 * Mean RGB color of a sampled region. Produced per poll and consumed immediately.
 */
public record ColorSample(double red, double green, double blue) {

    public double distanceSquaredTo(double[] centroid) {
        double dr = red - centroid[0];
        double dg = green - centroid[1];
        double db = blue - centroid[2];
        return dr * dr + dg * dg + db * db;
    }
}
