package capture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LensMetadataStoreTest {

    @Test
    @DisplayName("Nothing is known before the first frame")
    void latest_NoFrame_Null() {
        LensMetadataStore store = new LensMetadataStore();

        assertThat(store.latestIso()).isNull();
        assertThat(store.latestExposureNs()).isNull();
        assertThat(store.latestFocusDistanceDiopters()).isNull();
    }

    @Test
    @DisplayName("A snapshot keeps the values of the moment it was taken")
    void snapshot_LaterFrame_Unchanged() {
        LensMetadataStore store = new LensMetadataStore();
        store.onFrameMetadata(100, 8_000_000L, 4f);

        LensMetadataStore.Snapshot snapshot = store.snapshot();
        store.onFrameMetadata(400, null, null);

        assertThat(snapshot.iso()).isEqualTo(100);
        assertThat(snapshot.exposureNs()).isEqualTo(8_000_000L);
        assertThat(snapshot.focusDistanceDiopters()).isEqualTo(4f);
        assertThat(store.latestIso()).isEqualTo(400);
        assertThat(store.latestFocusDistanceDiopters()).isNull();
    }
}
