package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.events.CareProfile;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a report is
 * processed share the same identifiers (report, review session, owner, stage).
 */
final class ReportProcessingMdc {

    private static final String KEY_REPORT_ID = "report.id";
    private static final String KEY_SESSION = "report.session";
    private static final String KEY_OWNER = "report.owner";
    private static final String KEY_STAGE = "report.stage";

    private ReportProcessingMdc() {
        // Utility class
    }

    static Context open(String reportId) {
        return new Context(reportId);
    }

    static void attachProfile(CareProfile profile) {
        putIfHasText(KEY_OWNER, profile != null ? profile.ownerId() : null);
    }

    static void attachSession(String sessionId) {
        putIfHasText(KEY_SESSION, sessionId);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String reportId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_REPORT_ID, reportId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
