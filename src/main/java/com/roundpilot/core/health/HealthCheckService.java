package com.roundpilot.core.health;

import com.roundpilot.core.RoundpilotException;
import com.roundpilot.core.config.RoundpilotProperties;
import com.roundpilot.core.config.SourceConfigFactory;
import com.roundpilot.core.layout.LayoutCatalog;
import com.roundpilot.core.layout.LayoutLoader;
import com.roundpilot.core.phase.NearestCentroidModel;
import com.roundpilot.core.phase.PhaseClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.awt.GraphicsEnvironment;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final RoundpilotProperties properties;
    private final DataSource dataSource;

    public HealthCheckService(
            RoundpilotProperties properties,
            @Autowired(required = false) DataSource dataSource) {
        this.properties = properties;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkModel());
        results.add(checkLayout());
        results.add(checkInputDevice());
        return results;
    }

    HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("url", conn.getMetaData().getURL()));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkModel() {
        try {
            var model = NearestCentroidModel.load(Path.of(properties.getModelFile()));
            var mapping = PhaseClassifier.parseMapping(properties.getPhaseMapping());
            var metadata = Map.of(
                    "clusters", String.valueOf(model.clusterCount()),
                    "mapped", String.valueOf(mapping.size()));
            if (model.clusterCount() > mapping.size()) {
                return new HealthStatus("model", HealthStatus.Status.DEGRADED,
                        "Model has more clusters than the phase mapping; extra clusters read as UNKNOWN",
                        metadata);
            }
            return new HealthStatus("model", HealthStatus.Status.UP,
                    "Phase model loaded from " + properties.getModelFile(), metadata);
        } catch (RoundpilotException e) {
            return new HealthStatus("model", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }

    HealthStatus checkLayout() {
        try {
            LayoutCatalog catalog = LayoutLoader.load(Path.of(properties.getLayoutFile()));
            int sources = SourceConfigFactory.build(properties, catalog).size();
            return new HealthStatus("layout", HealthStatus.Status.UP,
                    sources + " sources resolved on layout " + properties.getLayout(),
                    Map.of("sources", String.valueOf(sources)));
        } catch (RoundpilotException e) {
            return new HealthStatus("layout", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }

    HealthStatus checkInputDevice() {
        if (GraphicsEnvironment.isHeadless()) {
            return new HealthStatus("input-device", HealthStatus.Status.DOWN,
                    "Headless environment: no screen or input device", Map.of());
        }
        return new HealthStatus("input-device", HealthStatus.Status.UP,
                "Screen and input device available", Map.of());
    }
}
