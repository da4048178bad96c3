package capture;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Logger;

import org.apache.commons.lang3.tuple.Pair;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     QualityAnalyzer class                                       */
/*                                     QualityAnalyzer class                                       */
/*                                     QualityAnalyzer class                                       */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Image quality of live frames for deciding if a frame is worth keeping.
 *
 * Blur is the variance of a sampled 4-neighbor Laplacian over a center ROI; larger values are sharper.
 * Exposure is the fraction of sampled ROI pixels clipped high or low. Clipped highlights are grouped
 * into 8-connected clusters so a few specular dots are told apart from a blown out region.
 *
 * Called by a single frame processing thread at sensor rate; frames arriving sooner than the
 * target rate are dropped. The latest result is published for any reader by an atomic swap.
 */
public class QualityAnalyzer
{
    private static final Logger LOGGER = Logger.getLogger(QualityAnalyzer.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final QualitySettings settings;
    private final FocusDistanceSource focusDistance;
    private final Consumer<QualityResult> onResult;
    private final long intervalNs;

    // written only by the frame processing thread
    private long lastAnalyzeNs;
    private boolean analyzedAny = false;

    private final AtomicReference<QualityResult> latest = new AtomicReference<>(QualityResult.unknown());

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     QualityAnalyzer constructor                                 */
/*                                     QualityAnalyzer constructor                                 */
/*                                     QualityAnalyzer constructor                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public QualityAnalyzer(QualitySettings settings, FocusDistanceSource focusDistance, Consumer<QualityResult> onResult)
    {
        this.settings = Objects.requireNonNull(settings, "settings").copy();
        this.settings.validate();
        this.focusDistance = focusDistance != null ? focusDistance : () -> null;
        this.onResult = onResult != null ? onResult : result -> {};
        this.intervalNs = 1_000_000_000L / Math.max(1, this.settings.targetFps);
        LOGGER.config("quality analyzer " + this.settings.targetFps + " fps, blur threshold " + this.settings.blurThreshold
            + ", clip " + this.settings.clipLow + "/" + this.settings.clipHigh);
    }

    public QualityAnalyzer(FocusDistanceSource focusDistance)
    {
        this(new QualitySettings(), focusDistance, null);
    }

    /**
     * @return latest published result, {@link QualityStatus#UNKNOWN} before the first analyzed frame
     */
    public QualityResult latest()
    {
        return latest.get();
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     analyze                                                     */
/*                                     analyze                                                     */
/*                                     analyze                                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Score one frame.
     *
     * @param frame luma view; not retained after return
     * @return the result, or null if the frame was skipped by the rate limit or has an unusable format
     */
    public QualityResult analyze(RawFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        if ( ! frame.format().isLumaCompatible())
        {
            LOGGER.fine("unsupported frame format " + frame.format() + " skipped");
            return null;
        }

        long nowNs = frame.timestampNs();
        if (analyzedAny && (nowNs - lastAnalyzeNs) < intervalNs)
        {
            return null; // too soon; dropped, not queued
        }
        lastAnalyzeNs = nowNs;
        analyzedAny = true;

        final int width = frame.width();
        final int height = frame.height();

        // center ROI
        final int roiW = Math.min(width, Math.max(settings.roiMinSide, (int)(width * settings.roiFrac)));
        final int roiH = Math.min(height, Math.max(settings.roiMinSide, (int)(height * settings.roiFrac)));
        final int startX = Math.max(0, (width - roiW) / 2);
        final int startY = Math.max(0, (height - roiH) / 2);

        final double variance = laplacianVariance(frame, startX, startY, roiW, roiH, Cfg.laplacianStep);

        // exposure on the ROI; clipped highlights remembered on the sampling grid for clustering
        final int expStep = Cfg.exposureStep;
        int clippedHighCnt = 0;
        int clippedLowCnt = 0;
        int total = 0;
        Set<Long> clippedHigh = new HashSet<>();

        for (int y = startY; y < startY + roiH; y += expStep)
        {
            for (int x = startX; x < startX + roiW; x += expStep)
            {
                int v = frame.luma(x, y);
                if (v >= settings.clipHigh)
                {
                    clippedHighCnt++;
                    clippedHigh.add(gridKey((x - startX) / expStep, (y - startY) / expStep));
                }
                if (v <= settings.clipLow)
                {
                    clippedLowCnt++;
                }
                total++;
            }
        }

        final double overPct = total > 0 ? (double)clippedHighCnt / total : 0.;
        final double underPct = total > 0 ? (double)clippedLowCnt / total : 0.;

        Pair<Integer, Integer> clusters = specularClusters(clippedHigh);

        final Double distanceCm = distanceCm(focusDistance.latestFocusDistanceDiopters());

        QualityStatus status = classify(settings, variance, overPct, underPct, clusters.getLeft(), clusters.getRight());

        QualityResult result = new QualityResult(status, variance, overPct, underPct,
            clusters.getLeft(), clusters.getRight(), distanceCm, nowNs);

        LOGGER.log(Cfg.frameTraceLevel, result.toString());

        latest.set(result);
        onResult.accept(result);
        return result;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     laplacianVariance                                           */
/*                                     laplacianVariance                                           */
/*                                     laplacianVariance                                           */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Population variance of the discrete Laplacian (up + down + left + right - 4 * center)
     * sampled over the interior of the ROI.
     */
    static double laplacianVariance(RawFrame frame, int startX, int startY, int roiW, int roiH, int step)
    {
        double sum = 0.;
        double sumSq = 0.;
        int count = 0;

        for (int y = startY + 1; y < startY + roiH - 1; y += step)
        {
            for (int x = startX + 1; x < startX + roiW - 1; x += step)
            {
                int c  = frame.luma(x, y);
                int up = frame.luma(x, y - 1);
                int dn = frame.luma(x, y + 1);
                int lt = frame.luma(x - 1, y);
                int rt = frame.luma(x + 1, y);

                double lap = up + dn + lt + rt - 4 * c;
                sum += lap;
                sumSq += lap * lap;
                count++;
            }
        }

        if (count == 0)
        {
            return 0.;
        }
        double mean = sum / count;
        return sumSq / count - mean * mean;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     specularClusters                                            */
/*                                     specularClusters                                            */
/*                                     specularClusters                                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * 8-connected component labeling of clipped highlight positions.
     *
     * Stack based flood fill; visited positions are removed from a working copy of the set.
     *
     * @param clipped positions packed by {@link #gridKey(int, int)}
     * @return (number of clusters, size of the largest cluster)
     */
    static Pair<Integer, Integer> specularClusters(Set<Long> clipped)
    {
        Set<Long> remaining = new HashSet<>(clipped);
        Deque<Long> stack = new ArrayDeque<>();
        int clusterCount = 0;
        int largest = 0;

        while ( ! remaining.isEmpty())
        {
            Long seed = remaining.iterator().next();
            remaining.remove(seed);
            stack.push(seed);
            int size = 0;

            while ( ! stack.isEmpty())
            {
                long key = stack.pop();
                size++;
                int gx = gridX(key);
                int gy = gridY(key);
                for (int dy = -1; dy <= 1; dy++)
                {
                    for (int dx = -1; dx <= 1; dx++)
                    {
                        if (dx == 0 && dy == 0)
                        {
                            continue;
                        }
                        long neighbor = gridKey(gx + dx, gy + dy);
                        if (remaining.remove(neighbor))
                        {
                            stack.push(neighbor);
                        }
                    }
                }
            }

            clusterCount++;
            largest = Math.max(largest, size);
        }

        return Pair.of(clusterCount, largest);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     classify                                                    */
/*                                     classify                                                    */
/*                                     classify                                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Priority order: BLUR, then over exposure (SPECULAR if the clipped highlights are only a few
     * small clusters, else OVER), then UNDER, else OK.
     */
    static QualityStatus classify(QualitySettings settings, double variance, double overPct, double underPct,
        int clusterCount, int largestCluster)
    {
        if (variance < settings.blurThreshold)
        {
            return QualityStatus.BLUR;
        }
        if (overPct > settings.overThresh)
        {
            if (clusterCount <= settings.specularMaxClusters && largestCluster <= settings.specularMaxClusterSize)
            {
                return QualityStatus.SPECULAR;
            }
            return QualityStatus.OVER;
        }
        if (underPct > settings.underThresh)
        {
            return QualityStatus.UNDER;
        }
        return QualityStatus.OK;
    }

    /**
     * Focus distance is in diopters (1/m) so the subject distance is about 1/diopters meters.
     *
     * @return distance in cm, or null if unknown or focused at infinity
     */
    static Double distanceCm(Float diopters)
    {
        if (diopters == null || diopters <= 0f)
        {
            return null;
        }
        return 100. / diopters;
    }

    static long gridKey(int gx, int gy)
    {
        return ((long)gy << 32) | (gx & 0xFFFFFFFFL);
    }
    static int gridX(long key)
    {
        return (int)key;
    }
    static int gridY(long key)
    {
        return (int)(key >> 32);
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End QualityAnalyzer class                                   */
/*                                     End QualityAnalyzer class                                   */
/*                                     End QualityAnalyzer class                                   */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
