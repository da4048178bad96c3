package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FiducialMarkerDetector class                                */
/*                                     FiducialMarkerDetector class                                */
/*                                     FiducialMarkerDetector class                                */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Marker detection on the center of live frames.
 *
 * The center ROI is subsampled by an integer step into a working buffer owned by this detector,
 * handed to the {@link TagDetectorEngine}, and the detections are mapped back to full frame pixels.
 * Session counters are updated under the same lock {@link #reset()} takes so a reset is seen by
 * the next processed frame.
 */
public class FiducialMarkerDetector implements MarkerDetector
{
    private static final Logger LOGGER = Logger.getLogger(FiducialMarkerDetector.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final TagDetectorEngine engine;
    private final MarkerSettings settings;

    private volatile MarkerMode mode;
    private volatile List<Long> requiredIds = Collections.emptyList(); // sorted, distinct, unmodifiable

    // working buffer; used only by the frame processing thread
    private byte[] reduced = new byte[0];

    // session counters
    private final ReentrantLock sessionLock = new ReentrantLock();
    private long framesProcessed;
    private long framesAllRequiredVisible;
    private final Map<Long, Long> perTagCount = new TreeMap<>();

    private final AtomicReference<MarkerStatus> latest;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     FiducialMarkerDetector constructor                          */
/*                                     FiducialMarkerDetector constructor                          */
/*                                     FiducialMarkerDetector constructor                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public FiducialMarkerDetector(TagDetectorEngine engine, MarkerSettings settings, MarkerMode mode)
    {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.settings = Objects.requireNonNull(settings, "settings").copy();
        this.settings.validate();
        this.mode = Objects.requireNonNull(mode, "mode");
        this.latest = new AtomicReference<>(MarkerStatus.idle(0L, mode, 0, 0, requiredIds));
        LOGGER.config("marker detector " + mode + " roi " + this.settings.roiFrac + " min " + this.settings.roiMinSide
            + " step " + this.settings.downsampleStep + " " + this.settings.dictionaryName);
    }

    public FiducialMarkerDetector(TagDetectorEngine engine)
    {
        this(engine, new MarkerSettings(), MarkerMode.WARN);
    }

    @Override
    public MarkerStatus latest()
    {
        return latest.get();
    }

    @Override
    public void setMode(MarkerMode mode)
    {
        this.mode = Objects.requireNonNull(mode, "mode");
        LOGGER.config("marker mode " + mode);
    }

    public MarkerMode mode()
    {
        return mode;
    }

    @Override
    public void setRequiredIdentities(List<Long> ids)
    {
        this.requiredIds = normalizeIds(ids);
        LOGGER.config("required ids " + this.requiredIds);
    }

    public List<Long> requiredIdentities()
    {
        return requiredIds;
    }

    /**
     * @return ascending distinct ids, unmodifiable
     */
    static List<Long> normalizeIds(List<Long> ids)
    {
        if (ids == null || ids.isEmpty())
        {
            return Collections.emptyList();
        }
        TreeSet<Long> sorted = new TreeSet<>();
        for (Long id : ids)
        {
            if (id != null) sorted.add(id);
        }
        return Collections.unmodifiableList(new ArrayList<>(sorted));
    }

    @Override
    public void reset()
    {
        sessionLock.lock();
        try
        {
            framesProcessed = 0L;
            framesAllRequiredVisible = 0L;
            perTagCount.clear();
            latest.set(MarkerStatus.idle(0L, mode, 0, 0, requiredIds));
        }
        finally
        {
            sessionLock.unlock();
        }
        LOGGER.info("marker session reset");
    }

    @Override
    public MarkerSessionSummary sessionSummary()
    {
        sessionLock.lock();
        try
        {
            return new MarkerSessionSummary(framesProcessed, framesAllRequiredVisible, perTagCount, requiredIds);
        }
        finally
        {
            sessionLock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     process                                                     */
/*                                     process                                                     */
/*                                     process                                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    @Override
    public void process(RawFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        final MarkerMode mode = this.mode;
        final List<Long> required = this.requiredIds;
        final int width = frame.width();
        final int height = frame.height();

        if (mode == MarkerMode.OFF)
        {
            latest.set(MarkerStatus.idle(frame.timestampNs(), mode, width, height, required));
            return;
        }

        if ( ! frame.format().isLumaCompatible() || frame.pixelStride() != 1)
        {
            LOGGER.warning("unsupported frame format " + frame.format() + " pixel stride " + frame.pixelStride());
            latest.set(MarkerStatus.unsupported(frame.timestampNs(), mode, width, height, required));
            return;
        }

        final int step = settings.downsampleStep;
        final int roiW = Math.min(width, Math.max(settings.roiMinSide, (int)(width * settings.roiFrac)));
        final int roiH = Math.min(height, Math.max(settings.roiMinSide, (int)(height * settings.roiFrac)));
        final int startX = Math.max(0, (width - roiW) / 2);
        final int startY = Math.max(0, (height - roiH) / 2);
        final int rw = (roiW + step - 1) / step;
        final int rh = (roiH + step - 1) / step;

        downsample(frame, startX, startY, rw, rh, step);

        List<TagDetection> found;
        try
        {
            found = engine.detect(reduced, rw, rh);
        }
        catch (RuntimeException e)
        {
            LOGGER.log(Level.WARNING, "marker detection failed; frame treated as no markers", e);
            found = Collections.emptyList();
        }
        if (found == null)
        {
            found = Collections.emptyList();
        }

        final double roiArea = (double)roiW * roiH;
        List<TagDetection> detections = new ArrayList<>(found.size());
        for (TagDetection d : found)
        {
            detections.add(remap(d, startX, startY, step, roiArea));
        }

        Set<Long> present = new HashSet<>();
        for (TagDetection d : detections)
        {
            present.add(d.id());
        }
        List<Long> missing = new ArrayList<>();
        for (Long id : required)
        {
            if ( ! present.contains(id)) missing.add(id);
        }
        final boolean allRequiredVisible = missing.isEmpty();
        final boolean framingOk = GuidanceGeometry.framingOk(detections, width, height, settings.edgeMarginFrac);

        MarkerStatus status = new MarkerStatus(true, frame.timestampNs(), mode, width, height,
            detections, required, missing, allRequiredVisible, framingOk,
            MarkerStatusFormatter.guidanceText(detections.size(), required, missing, framingOk),
            MarkerStatusFormatter.displayText(detections.size(), required, missing, framingOk));

        sessionLock.lock();
        try
        {
            framesProcessed++;
            if (allRequiredVisible && ! required.isEmpty())
            {
                framesAllRequiredVisible++;
            }
            for (Long id : present)
            {
                perTagCount.merge(id, 1L, Long::sum);
            }
            latest.set(status);
        }
        finally
        {
            sessionLock.unlock();
        }

        LOGGER.log(Cfg.frameTraceLevel, status.toString());
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     downsample remap                                            */
/*                                     downsample remap                                            */
/*                                     downsample remap                                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Copy every step-th column of every step-th row of the ROI into the working buffer.
     */
    private void downsample(RawFrame frame, int startX, int startY, int rw, int rh, int step)
    {
        final int size = rw * rh;
        if (reduced.length != size)
        {
            reduced = new byte[size];
        }
        final byte[] src = frame.buffer();
        final int rowStride = frame.rowStride();
        for (int ry = 0; ry < rh; ry++)
        {
            int srcRow = (startY + ry * step) * rowStride + startX;
            int dst = ry * rw;
            for (int rx = 0; rx < rw; rx++)
            {
                reduced[dst + rx] = src[srcRow + rx * step];
            }
        }
    }

    /**
     * Reduced buffer coordinates to full frame: full = ROI origin + reduced * step.
     */
    static TagDetection remap(TagDetection d, int originX, int originY, int step, double roiArea)
    {
        final double cx = originX + d.centerX() * step;
        final double cy = originY + d.centerY() * step;
        if ( ! d.hasCorners())
        {
            return new TagDetection(d.id(), cx, cy, null, null);
        }
        double[] corners = d.cornersFlat();
        for (int i = 0; i < corners.length; i += 2)
        {
            corners[i] = originX + corners[i] * step;
            corners[i + 1] = originY + corners[i + 1] * step;
        }
        Double quality = roiArea > 0. ? GuidanceGeometry.clamp01(polygonArea(corners) / roiArea) : null;
        return new TagDetection(d.id(), cx, cy, corners, quality);
    }

    /**
     * Shoelace formula
     *
     * @param xy flattened vertices [x0 y0 x1 y1 ...]
     * @return absolute area
     */
    static double polygonArea(double[] xy)
    {
        final int n = xy.length / 2;
        double twice = 0.;
        for (int i = 0; i < n; i++)
        {
            int j = (i + 1) % n;
            twice += xy[2 * i] * xy[2 * j + 1] - xy[2 * j] * xy[2 * i + 1];
        }
        return Math.abs(twice) / 2.;
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End FiducialMarkerDetector class                            */
/*                                     End FiducialMarkerDetector class                            */
/*                                     End FiducialMarkerDetector class                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
