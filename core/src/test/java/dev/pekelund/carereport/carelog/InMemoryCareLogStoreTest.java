package dev.pekelund.carereport.carelog;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.normalize.QuantityUnit;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryCareLogStoreTest {

    private static final CareProfile PROFILE = new CareProfile("owner", "child");
    private static final Instant NINE_PM = Instant.parse("2024-03-04T21:00:00Z");

    private final InMemoryCareLogStore store = new InMemoryCareLogStore();

    @Test
    void queriesRecordsOfTheProfileWithinTheRange() {
        store.append(PROFILE, new BottleFeedRecord(NINE_PM, new BigDecimal("4"), QuantityUnit.OUNCE, null));
        store.append(PROFILE, new DiaperRecord(NINE_PM.minusSeconds(86_400), DiaperType.DIRTY));
        store.append(new CareProfile("owner", "sibling"), new DiaperRecord(NINE_PM, DiaperType.WET));

        List<ExistingRecord> records = store.query(PROFILE, new TimeRange(NINE_PM.minusSeconds(3600),
            NINE_PM.plusSeconds(3600)));

        assertThat(records).singleElement().satisfies(record -> {
            assertThat(record.kind()).isEqualTo(EventKind.FEED);
            assertThat(record.description()).isEqualTo("bottle feed");
            assertThat(record.quantity()).isEqualTo("4 ounce");
            assertThat(record.reference().collection()).isEqualTo("bottleFeedLogs");
        });
    }

    @Test
    void describesDiapersAndSleepForDuplicateMessages() {
        store.append(PROFILE, new DiaperRecord(NINE_PM, DiaperType.WET));
        store.append(PROFILE, new SleepRecord(NINE_PM.minusSeconds(7200), NINE_PM.minusSeconds(3600)));

        List<ExistingRecord> records = store.query(PROFILE, new TimeRange(NINE_PM.minusSeconds(86_400),
            NINE_PM.plusSeconds(60)));

        assertThat(records).extracting(ExistingRecord::description).containsExactly("sleep log", "wet diaper");
        assertThat(records.get(0).endTime()).isEqualTo(NINE_PM.minusSeconds(3600));
    }
}
