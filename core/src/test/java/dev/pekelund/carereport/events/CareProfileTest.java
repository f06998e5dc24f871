package dev.pekelund.carereport.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CareProfileTest {

    @Test
    void roundTripsThroughMetadata() {
        CareProfile profile = new CareProfile(" owner-1 ", "child-7");

        Map<String, String> metadata = profile.toMetadata();

        assertThat(metadata).containsEntry("report.owner.id", "owner-1").containsEntry("report.child.id", "child-7");
        assertThat(CareProfile.fromMetadata(metadata)).isEqualTo(new CareProfile("owner-1", "child-7"));
    }

    @Test
    void returnsNullWhenMetadataHasNoProfile() {
        assertThat(CareProfile.fromMetadata(Map.of("other", "value"))).isNull();
        assertThat(CareProfile.fromMetadata(null)).isNull();
    }

    @Test
    void blankValuesAreTreatedAsMissing() {
        CareProfile profile = new CareProfile("  ", "child-7");

        assertThat(profile.ownerId()).isNull();
        assertThat(profile.isComplete()).isFalse();
    }
}
