package com.roundpilot.core.layout;

import com.roundpilot.core.config.ConfigException;
import com.roundpilot.core.model.Region;
import com.roundpilot.core.model.RegionRole;
import com.roundpilot.core.model.ScreenPoint;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns layout-relative regions into absolute screen regions.
 * <p>
 * Stateless; safe to call from any thread.
 */
public final class RegionResolver {

    private RegionResolver() {}

    /**
     * Offsets every base region by {@code offset}; width and height are kept.
     *
     * @param baseRegions regions relative to the window origin
     * @param offset      position of the window on screen
     * @return a new map of absolute regions
     */
    public static Map<RegionRole, Region> resolve(Map<RegionRole, Region> baseRegions, PositionOffset offset) {
        if (offset == null) {
            throw new ConfigException("Position offset must not be null");
        }
        var resolved = new EnumMap<RegionRole, Region>(RegionRole.class);
        baseRegions.forEach((role, region) -> resolved.put(role, region.offsetBy(offset.left(), offset.top())));
        return resolved;
    }

    public static ScreenPoint resolve(ScreenPoint basePoint, PositionOffset offset) {
        if (offset == null) {
            throw new ConfigException("Position offset must not be null");
        }
        return basePoint.offsetBy(offset.left(), offset.top());
    }

    /**
     * Looks up the source and the named position in {@code catalog}, then resolves.
     *
     * @throws ConfigException if the source, layout or position is unknown
     */
    public static Map<RegionRole, Region> resolve(LayoutCatalog catalog, String layoutName,
                                                  String sourceId, String position) {
        var source = catalog.source(sourceId);
        return resolve(source.regions(), catalog.offset(layoutName, position));
    }
}
