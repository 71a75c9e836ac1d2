package com.roundpilot.core.phase;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundpilot.core.model.ColorSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * K-means style model: assigns a color to the closest centroid (squared Euclidean distance).
 * <p>
 * The artifact is a JSON export of the trained model's cluster centers:
 * <pre>{"centroids": [[r, g, b], ...]}</pre>
 * {@code cluster_centers_} is accepted as an alias for {@code centroids}.
 */
public class NearestCentroidModel implements ClusterModel {

    private static final Logger log = LoggerFactory.getLogger(NearestCentroidModel.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<double[]> centroids;

    public NearestCentroidModel(List<double[]> centroids) {
        if (centroids == null || centroids.isEmpty()) {
            throw new ModelLoadException("Model has no centroids");
        }
        for (double[] c : centroids) {
            if (c == null || c.length != 3) {
                throw new ModelLoadException("Every centroid must have exactly 3 components");
            }
        }
        this.centroids = List.copyOf(centroids);
    }

    public static NearestCentroidModel load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ModelLoadException("Model file not found: " + file);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read model file " + file, e);
        }
        JsonNode node = root.has("centroids") ? root.get("centroids") : root.path("cluster_centers_");
        if (!node.isArray()) {
            throw new ModelLoadException("Model file " + file + " has no 'centroids' array");
        }
        var centroids = new ArrayList<double[]>();
        for (JsonNode c : node) {
            if (!c.isArray() || c.size() != 3) {
                throw new ModelLoadException("Malformed centroid in " + file + ": " + c);
            }
            centroids.add(new double[]{c.get(0).asDouble(), c.get(1).asDouble(), c.get(2).asDouble()});
        }
        var model = new NearestCentroidModel(centroids);
        log.info("Loaded phase model from {} ({} clusters)", file, centroids.size());
        return model;
    }

    @Override
    public int predict(ColorSample sample) {
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < centroids.size(); i++) {
            double d = sample.distanceSquaredTo(centroids.get(i));
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    public int clusterCount() {
        return centroids.size();
    }
}
