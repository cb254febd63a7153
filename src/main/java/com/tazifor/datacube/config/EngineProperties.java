package com.tazifor.datacube.config;

import com.tazifor.datacube.udf.CollapsedTimePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine settings bound from {@code datacube.*}.
 */
@Data
@ConfigurationProperties(prefix = "datacube")
public class EngineProperties {

    private Workers workers = new Workers();
    private Neighborhood neighborhood = new Neighborhood();
    private Udf udf = new Udf();
    private Export export = new Export();

    @Data
    public static class Workers {
        /** Size of the tile worker pool. */
        private int threads = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Neighborhood {
        /** Smallest window, in pixels, accepted by apply_neighborhood. */
        private int minWindowSize = 32;
    }

    @Data
    public static class Udf {
        private CollapsedTimePolicy collapsedTimePolicy = CollapsedTimePolicy.FIRST_INSTANT;
        private Instant collapsedTimeLabel = Instant.EPOCH;
        /** Coordinate reference entry of the udf envelope. */
        private Map<String, Object> projection = new LinkedHashMap<>(Map.of("EPSG", 900913));
    }

    @Data
    public static class Export {
        private boolean prettyPrint = true;
    }
}
