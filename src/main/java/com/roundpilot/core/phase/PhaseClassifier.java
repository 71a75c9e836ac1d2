package com.roundpilot.core.phase;

import com.roundpilot.core.config.ConfigException;
import com.roundpilot.core.model.ColorSample;
import com.roundpilot.core.model.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a sampled color to a {@link Phase} through an injected {@link ClusterModel}.
 * <p>
 * The cluster-id-to-phase table is configuration, not an identity cast: the
 * trained model's cluster order is whatever training produced. Cluster ids
 * outside the table yield {@link Phase#UNKNOWN}.
 * <p>
 * Stateless after construction, so one instance may be shared by all source workers.
 */
public class PhaseClassifier {

    private static final Logger log = LoggerFactory.getLogger(PhaseClassifier.class);

    private final ClusterModel model;
    private final List<Phase> clusterToPhase;

    public PhaseClassifier(ClusterModel model, List<Phase> clusterToPhase) {
        this.model = model;
        this.clusterToPhase = List.copyOf(clusterToPhase);
    }

    /**
     * Builds the cluster table from phase names, e.g. {@code ["ENDED", "WAITING", ...]}.
     *
     * @throws ConfigException if a name is not a {@link Phase}
     */
    public static List<Phase> parseMapping(List<String> names) {
        var phases = new ArrayList<Phase>(names.size());
        for (String name : names) {
            try {
                phases.add(Phase.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Unknown phase '" + name + "' in roundpilot.phase-mapping", e);
            }
        }
        return phases;
    }

    public Phase classify(ColorSample sample) {
        int cluster = model.predict(sample);
        if (cluster < 0 || cluster >= clusterToPhase.size()) {
            log.debug("Cluster {} outside the phase table for RGB({}, {}, {})",
                    cluster, (int) sample.red(), (int) sample.green(), (int) sample.blue());
            return Phase.UNKNOWN;
        }
        return clusterToPhase.get(cluster);
    }
}
