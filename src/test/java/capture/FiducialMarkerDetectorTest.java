package capture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class FiducialMarkerDetectorTest {

    /**
     * Engine returning fixed detections and keeping a copy of what it was handed
     */
    private static final class RecordingEngine implements TagDetectorEngine {
        final List<TagDetection> result;
        byte[] lastGray;
        int lastWidth;
        int lastHeight;
        int calls;

        RecordingEngine(TagDetection... result) {
            this.result = Arrays.asList(result);
        }

        @Override
        public List<TagDetection> detect(byte[] gray, int width, int height) {
            lastGray = Arrays.copyOf(gray, width * height);
            lastWidth = width;
            lastHeight = height;
            calls++;
            return result;
        }
    }

    private static RawFrame patterned(int width, int height, long timestampNs) {
        byte[] luma = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                luma[y * width + x] = (byte) ((x * 7 + y * 3) % 256);
            }
        }
        return RawFrame.gray(width, height, luma, timestampNs);
    }

    @Test
    @DisplayName("Center ROI is subsampled into the working buffer")
    void process_400x300_ReducedRoiHandedToEngine() {
        RecordingEngine engine = new RecordingEngine();
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);
        RawFrame frame = patterned(400, 300, 5L);

        detector.process(frame);

        assertThat(engine.lastWidth).isEqualTo(120);
        assertThat(engine.lastHeight).isEqualTo(90);
        for (int ry = 0; ry < 90; ry += 7) {
            for (int rx = 0; rx < 120; rx += 11) {
                assertThat(engine.lastGray[ry * 120 + rx] & 0xFF)
                    .as("reduced %d,%d", rx, ry)
                    .isEqualTo(frame.luma(80 + 2 * rx, 60 + 2 * ry));
            }
        }
        assertThat(detector.latest().timestampNs()).isEqualTo(5L);
        assertThat(detector.latest().frameWidth()).isEqualTo(400);
        assertThat(detector.latest().guidanceText()).isEqualTo("No markers detected");
        assertThat(detector.latest().displayText()).isEqualTo("Markers: 0");
    }

    @Test
    @DisplayName("Detections are mapped back to full frame pixels with an area quality")
    void process_Detection_RemappedToFullFrame() {
        double[] corners = {5, 15, 15, 15, 15, 25, 5, 25};
        RecordingEngine engine = new RecordingEngine(new TagDetection(3, 10, 20, corners, null));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);

        detector.process(patterned(400, 300, 1L));

        MarkerStatus status = detector.latest();
        assertThat(status.detectedCount()).isEqualTo(1);
        TagDetection d = status.detections().get(0);
        assertThat(d.id()).isEqualTo(3L);
        assertThat(d.centerX()).isEqualTo(100.);
        assertThat(d.centerY()).isEqualTo(100.);
        assertThat(d.cornersFlat()).containsExactly(90, 90, 110, 90, 110, 110, 90, 110);
        assertThat(d.quality()).isCloseTo(400. / 43200., within(1e-12));
        assertThat(status.framingOk()).isTrue();
        assertThat(status.guidanceText()).isEqualTo("Markers OK");
    }

    @Test
    @DisplayName("Required ids are normalized and reported missing in ascending order")
    void process_RequiredIds_MissingReported() {
        RecordingEngine engine = new RecordingEngine(new TagDetection(7, 60, 45));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);
        detector.setRequiredIdentities(Arrays.asList(9L, 7L, 7L, null));

        assertThat(detector.requiredIdentities()).containsExactly(7L, 9L);

        detector.process(patterned(400, 300, 1L));

        MarkerStatus status = detector.latest();
        assertThat(status.missingRequiredIds()).containsExactly(9L);
        assertThat(status.allRequiredVisible()).isFalse();
        assertThat(status.guidanceText()).isEqualTo("Missing required: 9");
        assertThat(status.displayText()).isEqualTo("Markers: 1 | required 1/2");
        assertThat(detector.sessionSummary().framesAllRequiredVisible()).isZero();
        assertThat(detector.sessionSummary().perTagCount()).containsEntry(7L, 1L);
    }

    @Test
    @DisplayName("Frames with every required id visible are counted")
    void process_AllRequiredVisible_Counted() {
        RecordingEngine engine = new RecordingEngine(new TagDetection(7, 60, 45), new TagDetection(9, 70, 45));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);
        detector.setRequiredIdentities(List.of(9L, 7L));

        detector.process(patterned(400, 300, 1L));
        detector.process(patterned(400, 300, 2L));

        MarkerSessionSummary summary = detector.sessionSummary();
        assertThat(summary.framesProcessed()).isEqualTo(2L);
        assertThat(summary.framesAllRequiredVisible()).isEqualTo(2L);
        assertThat(summary.perTagCount()).containsExactly(
            org.assertj.core.api.Assertions.entry(7L, 2L), org.assertj.core.api.Assertions.entry(9L, 2L));
        assertThat(summary.requiredIds()).containsExactly(7L, 9L);
    }

    @Test
    @DisplayName("An engine failure is a frame without markers")
    void process_EngineThrows_NoMarkers() {
        TagDetectorEngine engine = mock(TagDetectorEngine.class);
        when(engine.detect(any(), anyInt(), anyInt())).thenThrow(new IllegalStateException("boom"));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);

        detector.process(patterned(400, 300, 1L));

        assertThat(detector.latest().detectedCount()).isZero();
        assertThat(detector.latest().guidanceText()).isEqualTo("No markers detected");
        assertThat(detector.sessionSummary().framesProcessed()).isEqualTo(1L);
    }

    @Test
    @DisplayName("OFF mode publishes an idle status without running the engine")
    void process_ModeOff_EngineNotCalled() {
        TagDetectorEngine engine = mock(TagDetectorEngine.class);
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine, new MarkerSettings(), MarkerMode.OFF);

        detector.process(patterned(400, 300, 9L));

        verifyNoInteractions(engine);
        assertThat(detector.latest().displayText()).isEqualTo("Markers: off");
        assertThat(detector.latest().timestampNs()).isEqualTo(9L);
        assertThat(detector.sessionSummary().framesProcessed()).isZero();
    }

    @Test
    @DisplayName("An idle status with required ids lists them all as missing")
    void process_ModeOffWithRequired_AllMissing() {
        TagDetectorEngine engine = mock(TagDetectorEngine.class);
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine, new MarkerSettings(), MarkerMode.OFF);
        detector.setRequiredIdentities(List.of(7L, 4L));

        detector.process(patterned(400, 300, 9L));

        assertThat(detector.latest().missingRequiredIds()).containsExactly(4L, 7L);
        assertThat(detector.latest().allRequiredVisible()).isFalse();

        detector.reset();

        assertThat(detector.latest().missingRequiredIds()).containsExactly(4L, 7L);
        assertThat(detector.latest().allRequiredVisible()).isFalse();
    }

    @Test
    @DisplayName("Interleaved pixels are an unsupported format")
    void process_PixelStride2_Unsupported() {
        RecordingEngine engine = new RecordingEngine(new TagDetection(1, 60, 45));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);
        detector.setRequiredIdentities(List.of(4L));

        detector.process(new RawFrame(200, 200, 400, 2, new byte[400 * 200], 1L, PixelFormat.YUV_420_888));

        assertThat(engine.calls).isZero();
        assertThat(detector.latest().guidanceText()).isEqualTo("Unsupported format");
        assertThat(detector.latest().missingRequiredIds()).containsExactly(4L);
        assertThat(detector.sessionSummary().framesProcessed()).isZero();
    }

    @Test
    @DisplayName("Reset clears the session counters")
    void reset_AfterFrames_CountersCleared() {
        RecordingEngine engine = new RecordingEngine(new TagDetection(2, 60, 45));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);
        detector.process(patterned(400, 300, 1L));

        detector.reset();

        MarkerSessionSummary summary = detector.sessionSummary();
        assertThat(summary.framesProcessed()).isZero();
        assertThat(summary.perTagCount()).isEmpty();
        assertThat(detector.latest().displayText()).isEqualTo("Markers: waiting");
    }

    @Test
    @DisplayName("A detection near the corner of a small frame fails framing")
    void process_SmallFrameNearEdge_FramingFails() {
        RecordingEngine engine = new RecordingEngine(new TagDetection(1, 2, 2));
        FiducialMarkerDetector detector = new FiducialMarkerDetector(engine);

        detector.process(patterned(170, 170, 1L));

        assertThat(engine.lastWidth).isEqualTo(80);
        MarkerStatus status = detector.latest();
        assertThat(status.detections().get(0).centerX()).isEqualTo(9.);
        assertThat(status.framingOk()).isFalse();
        assertThat(status.guidanceText()).isEqualTo("Reframe: keep tags away from edges");
        assertThat(status.displayText()).isEqualTo("Markers: 1 | edge");
    }

    @Test
    @DisplayName("Bad settings are rejected")
    void constructor_BadStep_Throws() {
        MarkerSettings settings = new MarkerSettings();
        settings.downsampleStep = 0;

        assertThatThrownBy(() -> new FiducialMarkerDetector(new RecordingEngine(), settings, MarkerMode.WARN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Shoelace area of simple polygons")
    void polygonArea_Shapes() {
        assertThat(FiducialMarkerDetector.polygonArea(new double[] {0, 0, 1, 0, 1, 1, 0, 1})).isEqualTo(1.);
        assertThat(FiducialMarkerDetector.polygonArea(new double[] {0, 0, 0, 2, 2, 2, 2, 0})).isEqualTo(4.);
        assertThat(FiducialMarkerDetector.polygonArea(new double[] {0, 0, 4, 0, 0, 3})).isEqualTo(6.);
    }

    @Test
    @DisplayName("Normalizing ids sorts and removes duplicates")
    void normalizeIds_Lists() {
        assertThat(FiducialMarkerDetector.normalizeIds(null)).isEmpty();
        assertThat(FiducialMarkerDetector.normalizeIds(new ArrayList<>(List.of(5L, 1L, 5L, 3L)))).containsExactly(1L, 3L, 5L);
        assertThat(FiducialMarkerDetector.normalizeIds(Collections.emptyList())).isEmpty();
    }

    @Test
    @DisplayName("The disabled detector reports not available")
    void disabledDetector_NotAvailable() {
        MarkerDetector detector = new DisabledMarkerDetector();

        detector.process(patterned(400, 300, 1L));

        assertThat(detector.latest().isEnabled()).isFalse();
        assertThat(detector.latest().displayText()).isEqualTo("Markers detected: N/A");
        assertThat(detector.sessionSummary().framesProcessed()).isZero();
    }
}
