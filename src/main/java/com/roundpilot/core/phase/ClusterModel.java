package com.roundpilot.core.phase;

import com.roundpilot.core.model.ColorSample;

/**
 * Pre-trained clustering model over RGB colors.
 */
@FunctionalInterface
public interface ClusterModel {

    /**
     * @return the cluster id assigned to {@code sample}
     */
    int predict(ColorSample sample);
}
