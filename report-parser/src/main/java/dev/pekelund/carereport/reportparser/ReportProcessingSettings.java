package dev.pekelund.carereport.reportparser;

import com.google.cloud.ServiceOptions;
import dev.pekelund.carereport.reportparser.firestore.CareLogCollections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore settings resolved for the report service from its environment.
 */
public record ReportProcessingSettings(
    String projectId,
    CareLogCollections collections
) {

    private static final String DEFAULT_LOCAL_PROJECT_ID = "care-report-local";

    public static ReportProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static ReportProcessingSettings fromEnvironment(Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        CareLogCollections collections = new CareLogCollections(
            env.getOrDefault("CARE_REPORT_SLEEP_COLLECTION", CareLogCollections.DEFAULT_SLEEP_COLLECTION),
            env.getOrDefault("CARE_REPORT_BOTTLE_FEED_COLLECTION", CareLogCollections.DEFAULT_BOTTLE_FEED_COLLECTION),
            env.getOrDefault("CARE_REPORT_NURSING_COLLECTION", CareLogCollections.DEFAULT_NURSING_COLLECTION),
            env.getOrDefault("CARE_REPORT_DIAPER_COLLECTION", CareLogCollections.DEFAULT_DIAPER_COLLECTION),
            env.getOrDefault("CARE_REPORT_ACTIVITY_COLLECTION", CareLogCollections.DEFAULT_ACTIVITY_COLLECTION));
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);

        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while running on"
                + " Cloud Run. Update the deployment environment to use the production project id.", projectId));
        }

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new ReportProcessingSettings(projectId, collections);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
