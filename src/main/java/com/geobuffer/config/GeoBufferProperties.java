package com.geobuffer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code geobuffer} prefix
 */
@Data
@ConfigurationProperties(prefix = "geobuffer")
public class GeoBufferProperties {

    private Analysis analysis = new Analysis();

    private Index index = new Index();

    @Data
    public static class Analysis {

        /**
         * Upper bound for a single radius query. Zero waits forever, so one stalled
         * query holds the whole analysis.
         */
        private Duration queryTimeout = Duration.ZERO;
    }

    @Data
    public static class Index {

        /**
         * Threads serving radius queries
         */
        private int queryThreads = 8;
    }
}
