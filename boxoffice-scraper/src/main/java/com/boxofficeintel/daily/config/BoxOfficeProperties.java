package com.boxofficeintel.daily.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
@ConfigurationProperties(prefix = "boxoffice")
@Data
public class BoxOfficeProperties {

    private Source source = new Source();
    private Collection collection = new Collection();
    private Matching matching = new Matching();
    private Aggregation aggregation = new Aggregation();
    private Catalog catalog = new Catalog();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Source {
        /** {date} is replaced with the ISO date */
        private String dateUrlTemplate = "https://www.boxofficemojo.com/date/{date}/";
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
        private long requestDelayMs = 2000;
        private long connectTimeoutMs = 10_000;
        private long readTimeoutMs = 15_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Collection {
        private LocalDate startDate = LocalDate.of(2024, 1, 1);
        /** Null means "through yesterday" */
        private LocalDate endDate;
        private DatePolicy datePolicy = DatePolicy.DAILY;
        private int intervalDays = 14;
        private int failureThreshold = 10;
        /** Operator override used to recover from a corrupt checkpoint */
        private LocalDate resumeFrom;
        private boolean aggregateOnCompletion = true;

        public enum DatePolicy {
            DAILY, FIXED_INTERVAL, CALENDAR_AWARE
        }
    }

    @Data
    public static class Matching {
        private int releaseWindowDays = 14;
    }

    @Data
    public static class Aggregation {
        private int workerThreads = 4;
    }

    @Data
    public static class Catalog {
        private String path = "data/catalog/movies.json";
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.BOTH;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "data/output";
            private String fileName = "features.csv";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 6 * * ?";
        private boolean runOnStartup = false;
    }
}
