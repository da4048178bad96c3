package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class FrameAnalysisPipelineTest {

    private static final long FRAME_NS = 100_000_000L; // slower than the analysis rate limit

    private MarkerDetector detector;
    private QualityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        detector = mock(MarkerDetector.class);
        when(detector.latest()).thenReturn(MarkerStatus.idle(0L, MarkerMode.WARN, 0, 0, Collections.emptyList()));
        analyzer = new QualityAnalyzer(null);
    }

    private static RawFrame frame(long index) {
        return Frames.gray(200, 200, Frames.noise(200, 200, index), index * FRAME_NS);
    }

    @Test
    @DisplayName("A caller thread executor analyzes every frame in order")
    void submit_DirectExecutor_EveryFrameAnalyzed() {
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, Runnable::run);

        for (long i = 1; i <= 3; i++) {
            assertThat(pipeline.submit(frame(i))).isTrue();
        }

        assertThat(pipeline.processedCount()).isEqualTo(3L);
        assertThat(pipeline.droppedCount()).isZero();
        verify(detector, times(3)).process(any());
        assertThat(analyzer.latest().status()).isEqualTo(QualityStatus.OK);
        assertThat(analyzer.latest().timestampNs()).isEqualTo(3 * FRAME_NS);
    }

    @Test
    @DisplayName("Frames arriving while the worker is busy are replaced by the newest")
    void submit_BusyWorker_OnlyNewestKept() {
        List<Runnable> queued = new ArrayList<>();
        Executor later = queued::add;
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, later);
        RawFrame newest = frame(3);

        pipeline.submit(frame(1));
        pipeline.submit(frame(2));
        pipeline.submit(newest);

        assertThat(queued).hasSize(1);
        assertThat(pipeline.droppedCount()).isEqualTo(2L);
        verify(detector, never()).process(any());

        queued.remove(0).run();

        verify(detector).process(newest);
        verify(detector, times(1)).process(any());
        assertThat(pipeline.processedCount()).isEqualTo(1L);
        assertThat(queued).isEmpty();
    }

    @Test
    @DisplayName("A failing frame is skipped and the next frame is analyzed")
    void submit_DetectorThrows_PipelineContinues() {
        doThrow(new IllegalStateException("bad frame")).doNothing().when(detector).process(any());
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, Runnable::run);

        pipeline.submit(frame(1));
        pipeline.submit(frame(2));

        assertThat(pipeline.processedCount()).isEqualTo(1L);
        verify(detector, times(2)).process(any());
    }

    @Test
    @DisplayName("A capture snapshot freezes the latest results")
    void captureSnapshot_AfterFrame_LatestFrozen() {
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, Runnable::run);

        Pair<FrozenMarkerSnapshot, FrozenQualitySnapshot> before = pipeline.captureSnapshot();
        assertThat(before.getRight().status()).isEqualTo(QualityStatus.UNKNOWN);

        pipeline.submit(frame(1));
        Pair<FrozenMarkerSnapshot, FrozenQualitySnapshot> after = pipeline.captureSnapshot();

        assertThat(after.getRight().status()).isEqualTo(QualityStatus.OK);
        assertThat(after.getRight().exposureFlags()).isEmpty();
        assertThat(after.getLeft().mode()).isEqualTo(MarkerMode.WARN);
        assertThat(after.getLeft().detections()).isEmpty();
    }

    @Test
    @DisplayName("The owned worker analyzes frames off the caller thread and stops on shutdown")
    void submit_OwnedWorker_AnalyzedThenShutdown() {
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector);

        pipeline.submit(frame(1));
        verify(detector, timeout(TimeUnit.SECONDS.toMillis(5))).process(any());

        pipeline.shutdown();

        assertThat(pipeline.submit(frame(2))).isFalse();
    }

    @Test
    @DisplayName("A frame the worker refuses is not accepted and later frames still run")
    void submit_ExecutorRejects_FalseAndNotStuck() {
        AtomicInteger calls = new AtomicInteger();
        Executor refusesFirst = task -> {
            if (calls.getAndIncrement() == 0) {
                throw new RejectedExecutionException("worker stopped");
            }
            task.run();
        };
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, refusesFirst);
        RawFrame second = frame(2);

        assertThat(pipeline.submit(frame(1))).isFalse();
        verify(detector, never()).process(any());

        assertThat(pipeline.submit(second)).isTrue();

        verify(detector).process(second);
        verify(detector, times(1)).process(any());
        assertThat(pipeline.processedCount()).isEqualTo(1L);
        assertThat(pipeline.droppedCount()).isZero();
    }

    @Test
    @DisplayName("Nothing is accepted after shutdown")
    void submit_AfterShutdown_Rejected() {
        FrameAnalysisPipeline pipeline = new FrameAnalysisPipeline(analyzer, detector, Runnable::run);

        pipeline.shutdown();

        assertThat(pipeline.submit(frame(1))).isFalse();
        verify(detector, never()).process(any());
        assertThat(pipeline.qualityAnalyzer()).isSameAs(analyzer);
        assertThat(pipeline.markerDetector()).isSameAs(detector);
    }
}
