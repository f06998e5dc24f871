package dev.pekelund.carereport.reportparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.carereport.reportparser.firestore.CareLogCollections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ReportProcessingSettingsTest {

    private static final Supplier<String> NO_PROJECT = () -> null;

    @Test
    void fromEnvironmentUsesProjectIdEnvAndCollectionOverrides() {
        Map<String, String> env = new HashMap<>();
        env.put("PROJECT_ID", "explicit-project");
        env.put("CARE_REPORT_SLEEP_COLLECTION", "naps");

        ReportProcessingSettings settings = ReportProcessingSettings.fromEnvironment(env, NO_PROJECT);

        assertThat(settings.projectId()).isEqualTo("explicit-project");
        assertThat(settings.collections().sleep()).isEqualTo("naps");
        assertThat(settings.collections().bottleFeed()).isEqualTo(CareLogCollections.DEFAULT_BOTTLE_FEED_COLLECTION);
        assertThat(settings.collections().activity()).isEqualTo("activityLogs");
    }

    @Test
    void fromEnvironmentFallsBackToFirestoreProjectId() {
        Map<String, String> env = new HashMap<>();
        env.put("FIRESTORE_PROJECT_ID", "firestore-project");

        ReportProcessingSettings settings = ReportProcessingSettings.fromEnvironment(env, NO_PROJECT);

        assertThat(settings.projectId()).isEqualTo("firestore-project");
        assertThat(settings.collections()).isEqualTo(CareLogCollections.defaults());
    }

    @Test
    void fromEnvironmentUsesMetadataProjectWhenAvailable() {
        ReportProcessingSettings settings = ReportProcessingSettings.fromEnvironment(new HashMap<>(),
            () -> "care-report-prod");

        assertThat(settings.projectId()).isEqualTo("care-report-prod");
    }

    @Test
    void fromEnvironmentThrowsWhenLocalProjectDetectedOnCloudRun() {
        Map<String, String> env = new HashMap<>();
        env.put("PROJECT_ID", "care-report-local");
        env.put("K_SERVICE", "care-report-parser");

        assertThatThrownBy(() -> ReportProcessingSettings.fromEnvironment(env, () -> "care-report-prod"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("local project 'care-report-local'");
    }

    @Test
    void fromEnvironmentThrowsWhenProjectIdMissing() {
        assertThatThrownBy(() -> ReportProcessingSettings.fromEnvironment(new HashMap<>(), NO_PROJECT))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Firestore project id must be configured");
    }
}
