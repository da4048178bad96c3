package capture;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.tuple.Pair;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FrameAnalysisPipeline class                                 */
/*                                     FrameAnalysisPipeline class                                 */
/*                                     FrameAnalysisPipeline class                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Runs quality analysis and marker detection on one worker, one frame at a time.
 *
 * Only the newest submitted frame waits for the worker; a frame replaced before the worker takes
 * it is counted as dropped. Submitting never blocks. The submitter hands over the frame and must
 * not write its buffer afterwards.
 */
public class FrameAnalysisPipeline
{
    private static final Logger LOGGER = Logger.getLogger(FrameAnalysisPipeline.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final QualityAnalyzer qualityAnalyzer;
    private final MarkerDetector markerDetector;
    private final Executor executor;
    private final ExecutorService ownedExecutor; // null if the executor was supplied

    private final AtomicReference<RawFrame> pending = new AtomicReference<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private volatile boolean running = true;

    public FrameAnalysisPipeline(QualityAnalyzer qualityAnalyzer, MarkerDetector markerDetector)
    {
        this(qualityAnalyzer, markerDetector, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "frame-analysis");
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    /**
     * @param executor runs the drain task; must not run two tasks of this pipeline at once
     */
    public FrameAnalysisPipeline(QualityAnalyzer qualityAnalyzer, MarkerDetector markerDetector, Executor executor)
    {
        this(qualityAnalyzer, markerDetector, executor, false);
    }

    private FrameAnalysisPipeline(QualityAnalyzer qualityAnalyzer, MarkerDetector markerDetector, Executor executor,
        boolean owned)
    {
        this.qualityAnalyzer = Objects.requireNonNull(qualityAnalyzer, "qualityAnalyzer");
        this.markerDetector = Objects.requireNonNull(markerDetector, "markerDetector");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = owned ? (ExecutorService)executor : null;
    }

    /**
     * Offer a frame; replaces a frame still waiting.
     *
     * @return false if the pipeline is shut down or its worker refused the frame
     */
    public boolean submit(RawFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        if ( ! running)
        {
            return false;
        }
        if (pending.getAndSet(frame) != null)
        {
            dropped.incrementAndGet();
        }
        if ( ! schedule())
        {
            pending.compareAndSet(frame, null);
            return false;
        }
        return true;
    }

    /**
     * @return false if the executor refused the drain task
     */
    private boolean schedule()
    {
        if (scheduled.compareAndSet(false, true))
        {
            try
            {
                executor.execute(this::drain);
            }
            catch (RejectedExecutionException e)
            {
                scheduled.set(false);
                LOGGER.log(running ? Level.WARNING : Level.FINE, "frame analysis worker refused the frame", e);
                return false;
            }
        }
        return true;
    }

    private void drain()
    {
        try
        {
            RawFrame frame;
            while (running && (frame = pending.getAndSet(null)) != null)
            {
                analyze(frame);
            }
        }
        finally
        {
            scheduled.set(false);
        }
        // a frame may have arrived after the last take and before the flag was cleared
        if (running && pending.get() != null)
        {
            schedule();
        }
    }

    private void analyze(RawFrame frame)
    {
        try
        {
            qualityAnalyzer.analyze(frame);
            markerDetector.process(frame);
            processed.incrementAndGet();
        }
        catch (RuntimeException e)
        {
            LOGGER.log(Level.WARNING, "frame " + frame.timestampNs() + " skipped", e);
        }
    }

    /**
     * Freeze the latest marker status and quality result for a capture event
     *
     * @return (marker snapshot, quality snapshot)
     */
    public Pair<FrozenMarkerSnapshot, FrozenQualitySnapshot> captureSnapshot()
    {
        return Pair.of(FrozenMarkerSnapshot.from(markerDetector.latest()),
            FrozenQualitySnapshot.from(qualityAnalyzer.latest()));
    }

    public QualityAnalyzer qualityAnalyzer()
    {
        return qualityAnalyzer;
    }

    public MarkerDetector markerDetector()
    {
        return markerDetector;
    }

    /**
     * @return frames replaced before the worker took them
     */
    public long droppedCount()
    {
        return dropped.get();
    }

    public long processedCount()
    {
        return processed.get();
    }

    /**
     * Stop taking frames; waits briefly for the frame in progress if the worker is owned here.
     */
    public void shutdown()
    {
        running = false;
        pending.set(null);
        if (ownedExecutor != null)
        {
            ownedExecutor.shutdown();
            try
            {
                if ( ! ownedExecutor.awaitTermination(2, TimeUnit.SECONDS))
                {
                    LOGGER.warning("frame analysis worker did not stop");
                    ownedExecutor.shutdownNow();
                }
            }
            catch (InterruptedException e)
            {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("frame analysis stopped; processed " + processed.get() + ", dropped " + dropped.get());
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End FrameAnalysisPipeline class                             */
/*                                     End FrameAnalysisPipeline class                             */
/*                                     End FrameAnalysisPipeline class                             */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
