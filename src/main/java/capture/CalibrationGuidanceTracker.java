package capture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CalibrationGuidanceTracker class                            */
/*                                     CalibrationGuidanceTracker class                            */
/*                                     CalibrationGuidanceTracker class                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Coverage guidance and sufficiency of a calibration session.
 *
 * No phases and no identity tracking: the board should be seen in most cells of a 3x3 grid of
 * the frame at about the target distance. Statistics change only on a saved good capture.
 */
public class CalibrationGuidanceTracker
{
    private static final Logger LOGGER = Logger.getLogger(CalibrationGuidanceTracker.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final CalibrationGuidanceSettings settings;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final int[] gridCounts = new int[GuidanceGeometry.GRID_CELLS];
    private int goodCaptures;

    public CalibrationGuidanceTracker(CalibrationGuidanceSettings settings)
    {
        this.settings = Objects.requireNonNull(settings, "settings").copy();
        this.settings.validate();
        LOGGER.config("calibration targets " + this.settings.goodCapturesTarget + " shots, "
            + this.settings.gridTargetFilled + " cells, distance ~" + this.settings.distanceTargetCm + " cm");
    }

    public CalibrationGuidanceTracker()
    {
        this(new CalibrationGuidanceSettings());
    }

    public void resetForNewSession()
    {
        lock.lock();
        try
        {
            Arrays.fill(gridCounts, 0);
            goodCaptures = 0;
        }
        finally
        {
            lock.unlock();
        }
        LOGGER.info("calibration session reset");
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     buildLiveGuidance                                           */
/*                                     buildLiveGuidance                                           */
/*                                     buildLiveGuidance                                           */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Priority: no markers, reframe, distance, move to the first empty cell, keep going / enough.
     * Does not change any statistics.
     *
     * @param quality latest quality result, null if none yet
     */
    public CalibrationLiveGuidance buildLiveGuidance(MarkerStatus markerStatus, QualityResult quality)
    {
        Objects.requireNonNull(markerStatus, "markerStatus");

        final FrozenMarkerSnapshot marker = FrozenMarkerSnapshot.from(markerStatus);
        final Double distance = quality == null ? null : quality.distanceCm();
        final boolean distanceOk = distanceOk(distance);
        final boolean framingOk = framingOk(marker);

        lock.lock();
        try
        {
            final int filled = GuidanceGeometry.filledGridCells(gridCounts);
            final boolean enough = sufficiency().isEnough();

            String message;
            if (markerStatus.detectedCount() == 0)
            {
                message = "No markers: bring board/flags into view";
            }
            else if ( ! framingOk)
            {
                message = "Reframe: keep board away from edges";
            }
            else if ( ! distanceOk)
            {
                final String target = " (target ~" + Math.round(settings.distanceTargetCm) + " cm)";
                message = (distance != null && distance < settings.distanceMinCm ? "Move farther" : "Move closer") + target;
            }
            else if (filled < settings.gridTargetFilled)
            {
                int empty = GuidanceGeometry.firstEmptyGridCell(gridCounts);
                message = empty >= 0 ? "Move board to " + GuidanceGeometry.cellName(empty) : "Move board around the frame";
            }
            else
            {
                message = enough ? "Calibration enough" : "Keep going";
            }

            return new CalibrationLiveGuidance(message,
                "Calib shots: " + goodCaptures + "/" + settings.goodCapturesTarget,
                "Coverage: " + filled + "/" + GuidanceGeometry.GRID_CELLS,
                enough);
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     onCaptureSaved                                              */
/*                                     onCaptureSaved                                              */
/*                                     onCaptureSaved                                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Count a saved capture if quality is OK, markers are present, distance is in range and
     * framing is OK.
     *
     * @return true if counted
     */
    public boolean onCaptureSaved(FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality)
    {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(quality, "quality");

        final boolean qualityOk = quality.status() == QualityStatus.OK;
        final boolean hasMarkers = ! marker.detections().isEmpty();
        final boolean distanceOk = distanceOk(quality.distanceCm());
        final boolean framingOk = framingOk(marker);

        lock.lock();
        try
        {
            if ( ! (qualityOk && hasMarkers && distanceOk && framingOk))
            {
                LOGGER.fine("calibration capture not counted:" + (qualityOk ? "" : " quality " + quality.status())
                    + (hasMarkers ? "" : " no markers") + (distanceOk ? "" : " distance " + quality.distanceCm())
                    + (framingOk ? "" : " framing"));
                return false;
            }

            goodCaptures++;
            double[] center = GuidanceGeometry.meanCenterNorm(marker.detections(), marker.frameWidth(), marker.frameHeight());
            if (center != null)
            {
                gridCounts[GuidanceGeometry.gridIndex3x3(center[0], center[1])]++;
            }
            LOGGER.info("good calibration capture " + goodCaptures
                + (center == null ? "" : " cell " + GuidanceGeometry.cellName(GuidanceGeometry.gridIndex3x3(center[0], center[1]))));
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     sufficiency                                                 */
/*                                     sufficiency                                                 */
/*                                     sufficiency                                                 */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public boolean enough()
    {
        return sufficiency().isEnough();
    }

    public List<String> reasonsIfNotEnough()
    {
        return sufficiency().reasons();
    }

    /**
     * Reasons in fixed order: good captures then coverage
     */
    public Sufficiency sufficiency()
    {
        lock.lock();
        try
        {
            List<String> reasons = new ArrayList<>(2);
            if (goodCaptures < settings.goodCapturesTarget)
            {
                reasons.add("Need more good shots: " + goodCaptures + "/" + settings.goodCapturesTarget);
            }
            final int filled = GuidanceGeometry.filledGridCells(gridCounts);
            if (filled < settings.gridTargetFilled)
            {
                reasons.add("Coverage: " + filled + "/" + settings.gridTargetFilled);
            }
            return new Sufficiency(reasons);
        }
        finally
        {
            lock.unlock();
        }
    }

    public CalibrationManifestSummary buildManifestSummary()
    {
        lock.lock();
        try
        {
            Map<String, Integer> grid = new LinkedHashMap<>();
            for (int i = 0; i < GuidanceGeometry.GRID_CELLS; i++)
            {
                grid.put(Integer.toString(i), gridCounts[i]);
            }
            return new CalibrationManifestSummary(settings, goodCaptures, grid,
                GuidanceGeometry.filledGridCells(gridCounts), sufficiency());
        }
        finally
        {
            lock.unlock();
        }
    }

    public CalibrationSidecarSummary buildSidecarMarkerSummary(FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality)
    {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(quality, "quality");
        return new CalibrationSidecarSummary(settings.dictionaryName, marker, quality,
            framingOk(marker), distanceOk(quality.distanceCm()));
    }

    public int goodCaptures()
    {
        lock.lock();
        try
        {
            return goodCaptures;
        }
        finally
        {
            lock.unlock();
        }
    }

    public int coverageGridFilled()
    {
        lock.lock();
        try
        {
            return GuidanceGeometry.filledGridCells(gridCounts);
        }
        finally
        {
            lock.unlock();
        }
    }

    public int[] gridCounts()
    {
        lock.lock();
        try
        {
            return gridCounts.clone();
        }
        finally
        {
            lock.unlock();
        }
    }

    private boolean distanceOk(Double distanceCm)
    {
        if (distanceCm == null)
        {
            return true;
        }
        return distanceCm >= settings.distanceMinCm && distanceCm <= settings.distanceMaxCm;
    }

    private boolean framingOk(FrozenMarkerSnapshot marker)
    {
        if (marker.frameWidth() <= 0 || marker.frameHeight() <= 0)
        {
            return marker.framingOk();
        }
        return GuidanceGeometry.framingOk(marker.detections(), marker.frameWidth(), marker.frameHeight(),
            settings.edgeMarginFrac);
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End CalibrationGuidanceTracker class                        */
/*                                     End CalibrationGuidanceTracker class                        */
/*                                     End CalibrationGuidanceTracker class                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
