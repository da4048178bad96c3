package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CaptureGuidanceTracker class                                */
/*                                     CaptureGuidanceTracker class                                */
/*                                     CaptureGuidanceTracker class                                */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Phase guidance and sufficiency of a capture session.
 *
 * Statistics change only when a capture is saved ({@link #onCaptureSaved}), never per analyzed
 * frame, and only for captures that pass the good capture gate: quality OK, distance in range,
 * framing OK and at least one marker. The current phase is derived from the counters each time
 * it is needed; there is no stored phase.
 *
 * Every public method runs under one lock per tracker so a capture's counter update is atomic
 * with respect to a concurrent guidance or summary read.
 */
public class CaptureGuidanceTracker
{
    private static final Logger LOGGER = Logger.getLogger(CaptureGuidanceTracker.class.getName());
    static {
        LOGGER.finer("Loading");
    }

    private final CaptureGuidanceSettings settings;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private Counters counters = new Counters();
    private List<Long> stableIdsLocked = Collections.emptyList(); // empty until locked
    private List<Long> requiredIdsActive = Collections.emptyList();

    /**
     * Session statistics; replaced, never cleared field by field
     */
    private static final class Counters
    {
        final int[] gridCounts = new int[GuidanceGeometry.GRID_CELLS];
        final Map<Long, Integer> perTagCaptureCount = new LinkedHashMap<>();
        int goodCaptures;

        // anchor ring
        int aCenterMid;
        int aLeftMid;
        int aRightMid;
        int aHighAny;
        int aLowAny;

        // left sweep
        int bLeftMid;
        int bLeftHigh;
        int bLeftLow;

        // right sweep
        int cRightMid;
        int cRightHigh;
        int cRightLow;

        // cross-arch obliques
        int crossArchTotal;
        int crossArchHigh;
        int crossArchLow;
    }

    /**
     * Where the markers of a snapshot are in the frame
     */
    private static final class Placement
    {
        final int cell;
        final GuidanceGeometry.LateralBin lateral;
        final GuidanceGeometry.HeightBin height;
        final boolean crossArch;

        Placement(int cell, GuidanceGeometry.LateralBin lateral, GuidanceGeometry.HeightBin height, boolean crossArch)
        {
            this.cell = cell;
            this.lateral = lateral;
            this.height = height;
            this.crossArch = crossArch;
        }
    }

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     CaptureGuidanceTracker constructor                          */
/*                                     CaptureGuidanceTracker constructor                          */
/*                                     CaptureGuidanceTracker constructor                          */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public CaptureGuidanceTracker(CaptureGuidanceSettings settings)
    {
        this.settings = Objects.requireNonNull(settings, "settings").copy();
        this.settings.validate();
        LOGGER.config("capture targets " + this.settings.goodCapturesTarget + " shots, " + this.settings.gridTargetFilled
            + " cells, " + this.settings.perTagTarget + " per tag, cross-arch " + this.settings.crossArchRequired);
    }

    public CaptureGuidanceTracker()
    {
        this(new CaptureGuidanceSettings());
    }

    public void resetForNewSession()
    {
        lock.lock();
        try
        {
            counters = new Counters();
            stableIdsLocked = Collections.emptyList();
            requiredIdsActive = Collections.emptyList();
        }
        finally
        {
            lock.unlock();
        }
        LOGGER.info("capture session reset");
    }

    /**
     * Statistics collected for one required set are not comparable with another; changing the
     * required identities starts the statistics over.
     */
    public void onRequiredIdentitiesChanged(List<Long> newRequiredIds)
    {
        lock.lock();
        try
        {
            resetForRequired(FiducialMarkerDetector.normalizeIds(newRequiredIds));
        }
        finally
        {
            lock.unlock();
        }
    }

    private void resetForRequired(List<Long> required)
    {
        counters = new Counters();
        stableIdsLocked = Collections.emptyList();
        requiredIdsActive = required;
        LOGGER.info("required ids now " + required + "; capture statistics reset");
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
     * Count a saved capture if it is a good capture.
     *
     * @param marker marker status frozen when the capture was taken
     * @param quality quality verdict frozen when the capture was taken
     * @param markerSession session counters of the marker detector for choosing stable ids
     * @return true if the capture passed the gate and was counted
     */
    public boolean onCaptureSaved(FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality,
        MarkerSessionSummary markerSession)
    {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(markerSession, "markerSession");

        lock.lock();
        try
        {
            final boolean qualityOk = quality.status() == QualityStatus.OK;
            final boolean distanceOk = distanceOk(quality.distanceCm());
            final boolean framingOk = framingOk(marker);
            final boolean hasMarkers = ! marker.detections().isEmpty();

            if ( ! (qualityOk && distanceOk && framingOk && hasMarkers))
            {
                LOGGER.fine("capture not counted:" + (qualityOk ? "" : " quality " + quality.status())
                    + (distanceOk ? "" : " distance " + quality.distanceCm())
                    + (framingOk ? "" : " framing") + (hasMarkers ? "" : " no markers"));
                return false;
            }

            // statistics follow the active required set; only onRequiredIdentitiesChanged resets them
            final List<Long> required = requiredIdsActive;
            final List<Long> snapshotRequired = FiducialMarkerDetector.normalizeIds(marker.requiredIds());
            if ( ! snapshotRequired.equals(required))
            {
                LOGGER.warning("capture snapshot required ids " + snapshotRequired + " differ from active "
                    + required + "; counted against the active set");
            }

            final Counters c = counters;
            c.goodCaptures++;

            Placement placement = placement(marker);
            if (placement != null)
            {
                c.gridCounts[placement.cell]++;
                countPhaseBins(c, placement);
            }

            lockStableIdsIfPossible(required, markerSession.stableCandidates(settings.stableIdsN));
            List<Long> tracked = trackedIds(required, markerSession);

            Set<Long> present = new HashSet<>(marker.detectedIds());
            for (Long id : tracked)
            {
                if (present.contains(id))
                {
                    c.perTagCaptureCount.merge(id, 1, Integer::sum);
                }
                else
                {
                    c.perTagCaptureCount.putIfAbsent(id, 0); // deterministic summaries
                }
            }

            LOGGER.info("good capture " + c.goodCaptures + (placement == null ? "" : " cell "
                + GuidanceGeometry.cellName(placement.cell) + (placement.crossArch ? " cross-arch" : ""))
                + " phase " + livePhase(c));
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    private static void countPhaseBins(Counters c, Placement p)
    {
        final boolean mid = p.height == GuidanceGeometry.HeightBin.MID;
        final boolean high = p.height == GuidanceGeometry.HeightBin.HIGH;
        final boolean low = p.height == GuidanceGeometry.HeightBin.LOW;

        switch (p.lateral)
        {
            case LEFT:
                if (mid) { c.aLeftMid++; c.bLeftMid++; }
                if (high) c.bLeftHigh++;
                if (low) c.bLeftLow++;
                break;
            case CENTER:
                if (mid) c.aCenterMid++;
                break;
            case RIGHT:
                if (mid) { c.aRightMid++; c.cRightMid++; }
                if (high) c.cRightHigh++;
                if (low) c.cRightLow++;
                break;
        }
        if (high) c.aHighAny++;
        if (low) c.aLowAny++;

        if (p.crossArch)
        {
            c.crossArchTotal++;
            if (high) c.crossArchHigh++;
            if (low) c.crossArchLow++;
        }
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
     * Operator guidance for the current frame. Does not change any statistics; the frame may never
     * be captured.
     *
     * @param quality latest quality result, null if none yet
     */
    public CaptureLiveGuidance buildLiveGuidance(MarkerStatus markerStatus, QualityResult quality,
        MarkerSessionSummary markerSession)
    {
        Objects.requireNonNull(markerStatus, "markerStatus");
        Objects.requireNonNull(markerSession, "markerSession");

        final FrozenMarkerSnapshot marker = FrozenMarkerSnapshot.from(markerStatus);
        final Double distance = quality == null ? null : quality.distanceCm();
        final boolean distanceOk = distanceOk(distance);
        final boolean framingOk = framingOk(marker);
        final List<Long> required = marker.requiredIds();

        lock.lock();
        try
        {
            final Counters c = counters;
            final List<Long> tracked = trackedIds(required, markerSession);
            final CapturePhase phase = livePhase(c);
            final String coverage = "Coverage: " + GuidanceGeometry.filledGridCells(c.gridCounts) + "/" + GuidanceGeometry.GRID_CELLS;
            final Sufficiency sufficiency = sufficiency(c, tracked);

            String message;
            if (markerStatus.detectedCount() == 0)
            {
                message = "No markers: move closer / improve lighting";
            }
            else if ( ! required.isEmpty() && ! marker.missingRequiredIds().isEmpty())
            {
                message = "Missing: " + StringUtils.join(marker.missingRequiredIds(), ",");
            }
            else if ( ! framingOk)
            {
                message = "Reframe: keep tags away from edges";
            }
            else if ( ! distanceOk)
            {
                message = distanceHint(distance);
            }
            else if (phase == CapturePhase.CLEANUP)
            {
                message = cleanupHint(c, tracked, sufficiency);
            }
            else
            {
                message = phase.hint();
            }

            String blockReason = null;
            if (marker.mode() == MarkerMode.BLOCK)
            {
                if ( ! required.isEmpty() && ! marker.missingRequiredIds().isEmpty()) blockReason = "Missing required";
                else if ( ! framingOk) blockReason = "Framing";
                else if ( ! distanceOk) blockReason = "Distance";
            }

            return new CaptureLiveGuidance(message, phase, phaseProgressText(c, phase), coverage,
                sufficiency.isEnough(), blockReason);
        }
        finally
        {
            lock.unlock();
        }
    }

    private String distanceHint(Double distance)
    {
        final String target = " (target " + Math.round(settings.distanceMinCm) + "–" + Math.round(settings.distanceMaxCm) + " cm)";
        if (distance != null && distance < settings.distanceMinCm)
        {
            return "Move farther" + target;
        }
        return "Move closer" + target;
    }

    private String cleanupHint(Counters c, List<Long> tracked, Sufficiency sufficiency)
    {
        List<Long> weak = new ArrayList<>();
        for (Long id : tracked)
        {
            if (c.perTagCaptureCount.getOrDefault(id, 0) < settings.perTagTarget) weak.add(id);
        }
        if ( ! weak.isEmpty())
        {
            return "Cleanup: weak tags " + StringUtils.join(weak, ",") + " (need " + settings.perTagTarget + " each)";
        }
        if ( ! sufficiency.isEnough())
        {
            return sufficiency.reasons().get(0);
        }
        return "Enough";
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
    /**
     * @param markerSession used for the tracked ids when none are required and none are locked yet
     */
    public Sufficiency sufficiency(MarkerSessionSummary markerSession)
    {
        lock.lock();
        try
        {
            return sufficiency(counters, trackedIds(requiredIdsActive, markerSession));
        }
        finally
        {
            lock.unlock();
        }
    }

    public boolean enough(MarkerSessionSummary markerSession)
    {
        return sufficiency(markerSession).isEnough();
    }

    /**
     * Reasons in fixed order: good captures, coverage, cross-arch, then each tracked id.
     */
    private Sufficiency sufficiency(Counters c, List<Long> tracked)
    {
        List<String> reasons = new ArrayList<>();
        if (c.goodCaptures < settings.goodCapturesTarget)
        {
            reasons.add("Need more good shots: " + c.goodCaptures + "/" + settings.goodCapturesTarget);
        }
        final int filled = GuidanceGeometry.filledGridCells(c.gridCounts);
        if (filled < settings.gridTargetFilled)
        {
            reasons.add("Coverage: " + filled + "/" + settings.gridTargetFilled);
        }
        if (settings.crossArchRequired && ! isCrossArchComplete(c))
        {
            reasons.add("Cross-arch obliques missing");
        }
        for (Long id : tracked)
        {
            int count = c.perTagCaptureCount.getOrDefault(id, 0);
            if (count < settings.perTagTarget)
            {
                reasons.add("Tag " + id + ": " + count + "/" + settings.perTagTarget);
            }
        }
        return new Sufficiency(reasons);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     phases                                                      */
/*                                     phases                                                      */
/*                                     phases                                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    private CapturePhase livePhase(Counters c)
    {
        if ( ! isAnchorComplete(c)) return CapturePhase.ANCHOR;
        if ( ! isLeftSweepComplete(c)) return CapturePhase.LEFT_SWEEP;
        if ( ! isRightSweepComplete(c)) return CapturePhase.RIGHT_SWEEP;
        if ( ! isCrossArchComplete(c)) return CapturePhase.CROSS_ARCH;
        return CapturePhase.CLEANUP;
    }

    private boolean isAnchorComplete(Counters c)
    {
        return c.aCenterMid >= settings.anchorMidMin && c.aLeftMid >= settings.anchorMidMin
            && c.aRightMid >= settings.anchorMidMin
            && c.aHighAny >= settings.anchorHighLowMin && c.aLowAny >= settings.anchorHighLowMin;
    }

    private boolean isLeftSweepComplete(Counters c)
    {
        return c.bLeftMid >= settings.sweepMidMin && c.bLeftHigh >= settings.sweepHighLowMin
            && c.bLeftLow >= settings.sweepHighLowMin;
    }

    private boolean isRightSweepComplete(Counters c)
    {
        return c.cRightMid >= settings.sweepMidMin && c.cRightHigh >= settings.sweepHighLowMin
            && c.cRightLow >= settings.sweepHighLowMin;
    }

    private boolean isCrossArchComplete(Counters c)
    {
        return c.crossArchTotal >= settings.crossArchTotalMin && c.crossArchHigh >= settings.crossArchHighLowMin
            && c.crossArchLow >= settings.crossArchHighLowMin;
    }

    private String phaseProgressText(Counters c, CapturePhase phase)
    {
        final int am = settings.anchorMidMin;
        final int ahl = settings.anchorHighLowMin;
        final int sm = settings.sweepMidMin;
        final int shl = settings.sweepHighLowMin;
        switch (phase)
        {
            case ANCHOR:
            {
                int done = Math.min(c.aCenterMid, am) + Math.min(c.aLeftMid, am) + Math.min(c.aRightMid, am)
                    + Math.min(c.aHighAny, ahl) + Math.min(c.aLowAny, ahl);
                return "Phase A (Anchor): " + done + "/" + (3 * am + 2 * ahl);
            }
            case LEFT_SWEEP:
            {
                int done = Math.min(c.bLeftMid, sm) + Math.min(c.bLeftHigh, shl) + Math.min(c.bLeftLow, shl);
                return "Phase B (Left sweep): " + done + "/" + (sm + 2 * shl);
            }
            case RIGHT_SWEEP:
            {
                int done = Math.min(c.cRightMid, sm) + Math.min(c.cRightHigh, shl) + Math.min(c.cRightLow, shl);
                return "Phase C (Right sweep): " + done + "/" + (sm + 2 * shl);
            }
            case CROSS_ARCH:
                return "Phase D (Cross-arch): " + c.crossArchTotal + "/" + settings.crossArchTotalMin
                    + " (H:" + c.crossArchHigh + " L:" + c.crossArchLow + ")";
            default:
                return "Phase E (Cleanup)";
        }
    }

    /**
     * @return the first phase not yet complete, CLEANUP when all are
     */
    public CapturePhase phase()
    {
        lock.lock();
        try
        {
            return livePhase(counters);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return true once the phase's counters reach their thresholds; CLEANUP is never complete
     */
    public boolean isPhaseComplete(CapturePhase phase)
    {
        lock.lock();
        try
        {
            switch (phase)
            {
                case ANCHOR: return isAnchorComplete(counters);
                case LEFT_SWEEP: return isLeftSweepComplete(counters);
                case RIGHT_SWEEP: return isRightSweepComplete(counters);
                case CROSS_ARCH: return isCrossArchComplete(counters);
                default: return false;
            }
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     buildManifestSummary                                        */
/*                                     buildManifestSummary                                        */
/*                                     buildManifestSummary                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public CaptureManifestSummary buildManifestSummary(MarkerSessionSummary markerSession)
    {
        Objects.requireNonNull(markerSession, "markerSession");
        lock.lock();
        try
        {
            final Counters c = counters;
            final List<Long> tracked = trackedIds(requiredIdsActive, markerSession);

            Map<String, Integer> grid = new LinkedHashMap<>();
            for (int i = 0; i < GuidanceGeometry.GRID_CELLS; i++)
            {
                grid.put(Integer.toString(i), c.gridCounts[i]);
            }

            List<Long> idsSorted = new ArrayList<>(tracked);
            Collections.sort(idsSorted);
            Map<String, Integer> perTag = new LinkedHashMap<>();
            for (Long id : idsSorted)
            {
                perTag.put(Long.toString(id), c.perTagCaptureCount.getOrDefault(id, 0));
            }

            Map<String, Integer> phaseA = new LinkedHashMap<>();
            phaseA.put("centerMid", c.aCenterMid);
            phaseA.put("leftMid", c.aLeftMid);
            phaseA.put("rightMid", c.aRightMid);
            phaseA.put("highAny", c.aHighAny);
            phaseA.put("lowAny", c.aLowAny);
            Map<String, Integer> phaseB = new LinkedHashMap<>();
            phaseB.put("leftMid", c.bLeftMid);
            phaseB.put("leftHigh", c.bLeftHigh);
            phaseB.put("leftLow", c.bLeftLow);
            Map<String, Integer> phaseC = new LinkedHashMap<>();
            phaseC.put("rightMid", c.cRightMid);
            phaseC.put("rightHigh", c.cRightHigh);
            phaseC.put("rightLow", c.cRightLow);
            Map<String, Integer> phaseD = new LinkedHashMap<>();
            phaseD.put("total", c.crossArchTotal);
            phaseD.put("high", c.crossArchHigh);
            phaseD.put("low", c.crossArchLow);

            return new CaptureManifestSummary(settings, new ArrayList<>(tracked), c.goodCaptures, grid,
                GuidanceGeometry.filledGridCells(c.gridCounts), perTag,
                new CaptureManifestSummary.PhaseProgress(phaseA, phaseB, phaseC, phaseD),
                sufficiency(c, tracked));
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     buildSidecarMarkerSummary                                   */
/*                                     buildSidecarMarkerSummary                                   */
/*                                     buildSidecarMarkerSummary                                   */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Marker facts of one capture with the derived distance, framing, phase and placement fields
     */
    public CaptureSidecarSummary buildSidecarMarkerSummary(FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality,
        MarkerSessionSummary markerSession)
    {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(markerSession, "markerSession");

        final Placement placement = placement(marker);
        List<Long> detectedSorted = new ArrayList<>(marker.detectedIds());
        Collections.sort(detectedSorted);

        lock.lock();
        try
        {
            return new CaptureSidecarSummary(settings.dictionaryName, marker, quality,
                new ArrayList<>(trackedIds(marker.requiredIds(), markerSession)), detectedSorted,
                framingOk(marker), distanceOk(quality.distanceCm()), livePhase(counters),
                placement == null ? null : placement.cell,
                placement == null ? null : placement.lateral.name(),
                placement == null ? null : placement.height.name(),
                placement != null && placement.crossArch);
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     counters access                                             */
/*                                     counters access                                             */
/*                                     counters access                                             */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    public int goodCaptures()
    {
        lock.lock();
        try
        {
            return counters.goodCaptures;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return copy of the 3x3 grid counts, row major
     */
    public int[] gridCounts()
    {
        lock.lock();
        try
        {
            return counters.gridCounts.clone();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return copy of the per tag capture counts in first counted order
     */
    public Map<Long, Integer> perTagCaptureCount()
    {
        lock.lock();
        try
        {
            return new LinkedHashMap<>(counters.perTagCaptureCount);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return locked tracked ids, empty if not yet locked
     */
    public List<Long> stableIdsLocked()
    {
        lock.lock();
        try
        {
            return stableIdsLocked;
        }
        finally
        {
            lock.unlock();
        }
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     helpers                                                     */
/*                                     helpers                                                     */
/*                                     helpers                                                     */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Required ids win; else the stable ids once locked; else the current most frequently seen ids.
     * Never locks; call with the lock held.
     */
    private List<Long> trackedIds(List<Long> required, MarkerSessionSummary markerSession)
    {
        if ( ! required.isEmpty())
        {
            return required;
        }
        if ( ! stableIdsLocked.isEmpty())
        {
            return stableIdsLocked;
        }
        return markerSession.stableCandidates(settings.stableIdsN);
    }

    private void lockStableIdsIfPossible(List<Long> required, List<Long> candidates)
    {
        if ( ! required.isEmpty())
        {
            stableIdsLocked = required;
            return;
        }
        if ( ! stableIdsLocked.isEmpty())
        {
            return;
        }
        if (settings.stableIdsN > 0 && candidates.size() >= settings.stableIdsN)
        {
            stableIdsLocked = Collections.unmodifiableList(new ArrayList<>(candidates.subList(0, settings.stableIdsN)));
            LOGGER.info("stable ids locked " + stableIdsLocked);
        }
    }

    private boolean distanceOk(Double distanceCm)
    {
        if (distanceCm == null)
        {
            return true; // best effort signal; unknown does not block
        }
        return distanceCm >= settings.distanceMinCm && distanceCm <= settings.distanceMaxCm;
    }

    /**
     * Corners (or centers) against the edge margin; the snapshot's own verdict without a frame size
     */
    private boolean framingOk(FrozenMarkerSnapshot marker)
    {
        if (marker.frameWidth() <= 0 || marker.frameHeight() <= 0)
        {
            return marker.framingOk();
        }
        return GuidanceGeometry.framingOk(marker.detections(), marker.frameWidth(), marker.frameHeight(),
            settings.edgeMarginFrac);
    }

    /**
     * @return placement of the mean marker center, null without detections or frame size
     */
    private Placement placement(FrozenMarkerSnapshot marker)
    {
        final int w = marker.frameWidth();
        final int h = marker.frameHeight();
        double[] center = GuidanceGeometry.meanCenterNorm(marker.detections(), w, h);
        if (center == null)
        {
            return null;
        }
        return new Placement(
            GuidanceGeometry.gridIndex3x3(center[0], center[1]),
            GuidanceGeometry.lateralBin(center[0]),
            GuidanceGeometry.heightBin(center[1]),
            GuidanceGeometry.isCrossArch(marker.detections(), w, settings.crossArchSpreadMin));
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End CaptureGuidanceTracker class                            */
/*                                     End CaptureGuidanceTracker class                            */
/*                                     End CaptureGuidanceTracker class                            */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
