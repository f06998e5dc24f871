package dev.pekelund.carereport.reportparser;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the report pipeline, bound from {@code care-report.*}.
 */
@ConfigurationProperties(prefix = "care-report")
public class CareReportProperties {

    /**
     * Zone caregivers write report times in, used when an upload does not name one.
     */
    private ZoneId zone = ZoneId.of("UTC");

    private final Duplicates duplicates = new Duplicates();

    private final History history = new History();

    private final Review review = new Review();

    private final Extraction extraction = new Extraction();

    private final Storage storage = new Storage();

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }

    public Duplicates getDuplicates() {
        return duplicates;
    }

    public History getHistory() {
        return history;
    }

    public Review getReview() {
        return review;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Storage getStorage() {
        return storage;
    }

    public static class Duplicates {

        /**
         * Distance within which an instant event matches an existing record.
         */
        private Duration instantTolerance = Duration.ofMinutes(15);

        /**
         * Length assumed for sleep entries that have no end time.
         */
        private Duration defaultSleepDuration = Duration.ofHours(1);

        public Duration getInstantTolerance() {
            return instantTolerance;
        }

        public void setInstantTolerance(Duration instantTolerance) {
            this.instantTolerance = instantTolerance;
        }

        public Duration getDefaultSleepDuration() {
            return defaultSleepDuration;
        }

        public void setDefaultSleepDuration(Duration defaultSleepDuration) {
            this.defaultSleepDuration = defaultSleepDuration;
        }
    }

    public static class History {

        /**
         * Padding added on both sides of a report's events when loading history for comparison.
         */
        private Duration padding = Duration.ofHours(12);

        /**
         * Upper bound of the history window.
         */
        private Duration maxWindow = Duration.ofDays(14);

        public Duration getPadding() {
            return padding;
        }

        public void setPadding(Duration padding) {
            this.padding = padding;
        }

        public Duration getMaxWindow() {
            return maxWindow;
        }

        public void setMaxWindow(Duration maxWindow) {
            this.maxWindow = maxWindow;
        }
    }

    public static class Review {

        /**
         * Idle time after which an open review session is dropped.
         */
        private Duration sessionTtl = Duration.ofHours(2);

        public Duration getSessionTtl() {
            return sessionTtl;
        }

        public void setSessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
        }
    }

    public static class Extraction {

        private Duration timeout = Duration.ofSeconds(45);

        /**
         * Number of extractions that may run at the same time.
         */
        private int threads = 4;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Storage {

        /**
         * Backend holding pending reports: {@code gcs} or {@code local}.
         */
        private String backend = "local";

        /**
         * Directory used by the {@code local} backend.
         */
        private String localDirectory = "./pending-reports";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getLocalDirectory() {
            return localDirectory;
        }

        public void setLocalDirectory(String localDirectory) {
            this.localDirectory = localDirectory;
        }
    }
}
