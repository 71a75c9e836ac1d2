package com.roundpilot.core.layout;

import com.roundpilot.core.config.ConfigException;
import com.roundpilot.core.model.Region;
import com.roundpilot.core.model.RegionRole;
import com.roundpilot.core.model.ScreenPoint;

import java.util.Map;
import java.util.Set;

/**
 * Screen layouts and per-source base regions, as read from the layout file.
 * <p>
 * Base regions and points are relative to the window origin; a layout supplies
 * the on-screen offset of each named window position.
 */
public record LayoutCatalog(Map<String, Layout> layouts, Map<String, SourceLayout> sources) {

    public LayoutCatalog {
        layouts = Map.copyOf(layouts);
        sources = Map.copyOf(sources);
    }

    /**
     * One screen arrangement, e.g. a 2x2 grid of equally sized windows.
     */
    public record Layout(int width, int height, Map<String, PositionOffset> positions) {
        public Layout {
            positions = Map.copyOf(positions);
        }
    }

    /**
     * Window-relative regions and click points of one source.
     */
    public record SourceLayout(Map<RegionRole, Region> regions, ScreenPoint amountField, ScreenPoint playButton) {
        public SourceLayout {
            regions = Map.copyOf(regions);
        }
    }

    public Layout layout(String name) {
        Layout layout = layouts.get(name);
        if (layout == null) {
            throw new ConfigException("Unknown layout '" + name + "'; known layouts: " + layouts.keySet());
        }
        return layout;
    }

    public PositionOffset offset(String layoutName, String position) {
        PositionOffset offset = layout(layoutName).positions().get(position);
        if (offset == null) {
            throw new ConfigException("Unknown position '" + position + "' in layout '" + layoutName
                    + "'; known positions: " + layout(layoutName).positions().keySet());
        }
        return offset;
    }

    public SourceLayout source(String sourceId) {
        SourceLayout source = sources.get(sourceId);
        if (source == null) {
            throw new ConfigException("Unknown source '" + sourceId + "'; known sources: " + sources.keySet());
        }
        return source;
    }

    public Set<String> sourceIds() {
        return sources.keySet();
    }
}
