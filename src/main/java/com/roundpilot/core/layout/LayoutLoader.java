package com.roundpilot.core.layout;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roundpilot.core.config.ConfigException;
import com.roundpilot.core.model.Region;
import com.roundpilot.core.model.RegionRole;
import com.roundpilot.core.model.ScreenPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a {@link LayoutCatalog} from the JSON layout file.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "layouts": { "Four_100": { "width": 1030, "height": 720,
 *                              "positions": { "TL": {"left": 0, "top": 0}, ... } } },
 *   "sources": { "BalkanBet": { "regions": { "phase": {"left":..,"top":..,"width":..,"height":..}, ... },
 *                               "points":  { "amount_field": {"x":..,"y":..}, "play_button": {...} } } }
 * }
 * </pre>
 * Every source must define all {@link RegionRole}s and both click points.
 */
public final class LayoutLoader {

    private static final Logger log = LoggerFactory.getLogger(LayoutLoader.class);

    static final String AMOUNT_FIELD = "amount_field";
    static final String PLAY_BUTTON = "play_button";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private LayoutLoader() {}

    public static LayoutCatalog load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigException("Layout file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            LayoutCatalog catalog = load(in);
            log.info("Loaded layout file {} ({} layouts, {} sources)",
                    file, catalog.layouts().size(), catalog.sources().size());
            return catalog;
        } catch (IOException e) {
            throw new ConfigException("Failed to read layout file " + file, e);
        }
    }

    public static LayoutCatalog load(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Layout file is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Layout file must contain a JSON object");
        }
        return new LayoutCatalog(parseLayouts(root.path("layouts")), parseSources(root.path("sources")));
    }

    private static Map<String, LayoutCatalog.Layout> parseLayouts(JsonNode node) {
        var layouts = new HashMap<String, LayoutCatalog.Layout>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var entry = it.next();
            JsonNode layout = entry.getValue();
            var positions = new HashMap<String, PositionOffset>();
            for (Iterator<Map.Entry<String, JsonNode>> p = layout.path("positions").fields(); p.hasNext(); ) {
                var pos = p.next();
                positions.put(pos.getKey(), new PositionOffset(
                        requiredInt(pos.getValue(), "left", entry.getKey() + "." + pos.getKey()),
                        requiredInt(pos.getValue(), "top", entry.getKey() + "." + pos.getKey())));
            }
            if (positions.isEmpty()) {
                throw new ConfigException("Layout '" + entry.getKey() + "' defines no positions");
            }
            layouts.put(entry.getKey(), new LayoutCatalog.Layout(
                    layout.path("width").asInt(0), layout.path("height").asInt(0), positions));
        }
        return layouts;
    }

    private static Map<String, LayoutCatalog.SourceLayout> parseSources(JsonNode node) {
        var sources = new HashMap<String, LayoutCatalog.SourceLayout>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            var entry = it.next();
            String sourceId = entry.getKey();
            JsonNode regionsNode = entry.getValue().path("regions");

            var regions = new EnumMap<RegionRole, Region>(RegionRole.class);
            for (RegionRole role : RegionRole.values()) {
                JsonNode r = regionsNode.path(role.key());
                if (r.isMissingNode()) {
                    throw new ConfigException("Source '" + sourceId + "' is missing region '" + role.key() + "'");
                }
                String where = sourceId + "." + role.key();
                try {
                    regions.put(role, new Region(
                            requiredInt(r, "left", where), requiredInt(r, "top", where),
                            requiredInt(r, "width", where), requiredInt(r, "height", where)));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("Invalid region " + where + ": " + e.getMessage(), e);
                }
            }
            for (Iterator<String> names = regionsNode.fieldNames(); names.hasNext(); ) {
                String name = names.next();
                if (RegionRole.fromKey(name).isEmpty()) {
                    log.warn("Ignoring unknown region '{}' for source '{}'", name, sourceId);
                }
            }

            JsonNode points = entry.getValue().path("points");
            sources.put(sourceId, new LayoutCatalog.SourceLayout(regions,
                    point(points, AMOUNT_FIELD, sourceId),
                    point(points, PLAY_BUTTON, sourceId)));
        }
        return sources;
    }

    private static ScreenPoint point(JsonNode points, String name, String sourceId) {
        JsonNode p = points.path(name);
        if (p.isMissingNode()) {
            throw new ConfigException("Source '" + sourceId + "' is missing click point '" + name + "'");
        }
        String where = sourceId + "." + name;
        return new ScreenPoint(requiredInt(p, "x", where), requiredInt(p, "y", where));
    }

    private static int requiredInt(JsonNode node, String field, String where) {
        JsonNode value = node.path(field);
        if (!value.canConvertToInt()) {
            throw new ConfigException("Missing or non-integer '" + field + "' at " + where);
        }
        return value.asInt();
    }
}
