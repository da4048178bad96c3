package capture;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class CalibrationGuidanceTrackerTest {

    private static final int SIZE = 1000;

    private static final FrozenQualitySnapshot GOOD = new FrozenQualitySnapshot(QualityStatus.OK, 500., List.of(), 25.);

    private static FrozenMarkerSnapshot board(double x, double y) {
        return FrozenMarkerSnapshot.of(MarkerMode.WARN, SIZE, SIZE, Collections.emptyList(),
            List.of(new TagDetection(0, x, y)));
    }

    private static MarkerStatus status(TagDetection... detections) {
        return new MarkerStatus(true, 1L, MarkerMode.WARN, SIZE, SIZE, Arrays.asList(detections),
            Collections.emptyList(), Collections.emptyList(), true, true, "", "");
    }

    private static QualityResult quality(Double distanceCm) {
        return new QualityResult(QualityStatus.OK, 500., 0., 0., 0, 0, distanceCm, 1L);
    }

    private static CalibrationGuidanceTracker tracker(int goodCaptures, int gridFilled) {
        CalibrationGuidanceSettings settings = new CalibrationGuidanceSettings();
        settings.goodCapturesTarget = goodCaptures;
        settings.gridTargetFilled = gridFilled;
        return new CalibrationGuidanceTracker(settings);
    }

    @Test
    @DisplayName("Two good captures in two cells are enough for targets of two")
    void onCaptureSaved_TwoCells_Enough() {
        CalibrationGuidanceTracker tracker = tracker(2, 2);

        assertThat(tracker.onCaptureSaved(board(200, 200), GOOD)).isTrue();
        assertThat(tracker.enough()).isFalse();
        assertThat(tracker.onCaptureSaved(board(500, 500), GOOD)).isTrue();

        assertThat(tracker.enough()).isTrue();
        assertThat(tracker.reasonsIfNotEnough()).isEmpty();

        assertThat(tracker.onCaptureSaved(board(200, 200), GOOD)).isTrue();
        assertThat(tracker.goodCaptures()).isEqualTo(3);
        assertThat(tracker.coverageGridFilled()).isEqualTo(2);
        assertThat(tracker.gridCounts()).containsExactly(2, 0, 0, 0, 1, 0, 0, 0, 0);
    }

    @Test
    @DisplayName("Captures failing quality, distance, framing or markers are not counted")
    void onCaptureSaved_Gate() {
        CalibrationGuidanceTracker tracker = new CalibrationGuidanceTracker();

        assertThat(tracker.onCaptureSaved(board(500, 500),
            new FrozenQualitySnapshot(QualityStatus.UNDER, 500., List.of("UNDER"), 25.))).isFalse();
        assertThat(tracker.onCaptureSaved(board(500, 500),
            new FrozenQualitySnapshot(QualityStatus.OK, 500., List.of(), 31.))).isFalse();
        assertThat(tracker.onCaptureSaved(board(950, 500), GOOD)).isFalse();
        assertThat(tracker.onCaptureSaved(FrozenMarkerSnapshot.of(MarkerMode.WARN, SIZE, SIZE,
            Collections.emptyList(), Collections.emptyList()), GOOD)).isFalse();

        assertThat(tracker.goodCaptures()).isZero();
        assertThat(tracker.reasonsIfNotEnough()).containsExactly("Need more good shots: 0/25", "Coverage: 0/8");
    }

    @Test
    @DisplayName("Guidance points at the first empty cell, then keep going, then enough")
    void buildLiveGuidance_Progression() {
        CalibrationGuidanceTracker tracker = tracker(3, 1);
        MarkerStatus live = status(new TagDetection(0, 500, 500));

        CalibrationLiveGuidance first = tracker.buildLiveGuidance(live, quality(25.));
        assertThat(first.message()).isEqualTo("Move board to top-left");
        assertThat(first.progress()).isEqualTo("Calib shots: 0/3");
        assertThat(first.coverageText()).isEqualTo("Coverage: 0/9");

        tracker.onCaptureSaved(board(500, 500), GOOD);
        assertThat(tracker.buildLiveGuidance(live, quality(25.)).message()).isEqualTo("Keep going");

        tracker.onCaptureSaved(board(500, 500), GOOD);
        tracker.onCaptureSaved(board(500, 500), GOOD);
        CalibrationLiveGuidance done = tracker.buildLiveGuidance(live, quality(25.));
        assertThat(done.message()).isEqualTo("Calibration enough");
        assertThat(done.enough()).isTrue();
    }

    @Test
    @DisplayName("Markers, framing and distance come before coverage")
    void buildLiveGuidance_Priorities() {
        CalibrationGuidanceTracker tracker = new CalibrationGuidanceTracker();

        assertThat(tracker.buildLiveGuidance(status(), quality(25.)).message())
            .isEqualTo("No markers: bring board/flags into view");
        assertThat(tracker.buildLiveGuidance(status(new TagDetection(0, 20, 500)), quality(40.)).message())
            .isEqualTo("Reframe: keep board away from edges");
        assertThat(tracker.buildLiveGuidance(status(new TagDetection(0, 500, 500)), quality(40.)).message())
            .isEqualTo("Move closer (target ~25 cm)");
        assertThat(tracker.buildLiveGuidance(status(new TagDetection(0, 500, 500)), quality(12.)).message())
            .isEqualTo("Move farther (target ~25 cm)");
        assertThat(tracker.goodCaptures()).isZero();
    }

    @Test
    @DisplayName("Summaries of a calibration session")
    void summaries_Json() {
        CalibrationGuidanceTracker tracker = tracker(2, 2);
        tracker.onCaptureSaved(board(200, 200), GOOD);

        JsonNode manifest = SummaryJson.readTree(SummaryJson.toJson(tracker.buildManifestSummary()));
        assertThat(manifest.get("goodCaptures").asInt()).isEqualTo(1);
        assertThat(manifest.get("coverageGridCounts").get("0").asInt()).isEqualTo(1);
        assertThat(manifest.get("targets").get("gridFilled").asInt()).isEqualTo(2);
        assertThat(manifest.get("distanceTargetCm").asDouble()).isEqualTo(25.);
        assertThat(manifest.get("reasonsIfNotEnough").get(0).asText()).isEqualTo("Need more good shots: 1/2");

        CalibrationSidecarSummary sidecar = tracker.buildSidecarMarkerSummary(board(200, 200), GOOD);
        assertThat(sidecar.dictionary).isEqualTo("APRILTAG_36h11");
        assertThat(sidecar.framingOk).isTrue();
        assertThat(sidecar.distanceOk).isTrue();
        assertThat(sidecar.detections).hasSize(1);
    }

    @Test
    @DisplayName("A new session clears the counters")
    void resetForNewSession_Clears() {
        CalibrationGuidanceTracker tracker = tracker(2, 2);
        tracker.onCaptureSaved(board(200, 200), GOOD);

        tracker.resetForNewSession();

        assertThat(tracker.goodCaptures()).isZero();
        assertThat(tracker.coverageGridFilled()).isZero();
    }
}
