package capture;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session level summary of a capture session for the manifest. Field names and the "0".."8" grid
 * keys (row major) are read by downstream tooling.
 */
public final class CaptureManifestSummary
{
    public final int version;
    public final int stableIdsN;
    public final List<Long> trackedIds;
    public final List<Double> distanceRangeCm;
    public final double edgeMarginFrac;
    public final int goodCaptures;
    public final Targets targets;
    public final Map<String, Integer> coverageGridCounts;
    public final int coverageGridFilled;
    public final Map<String, Integer> perTagCaptureCount;
    public final PhaseProgress phaseProgress;
    public final boolean enough;
    public final List<String> reasonsIfNotEnough;

    CaptureManifestSummary(CaptureGuidanceSettings settings, List<Long> trackedIds, int goodCaptures,
        Map<String, Integer> coverageGridCounts, int coverageGridFilled, Map<String, Integer> perTagCaptureCount,
        PhaseProgress phaseProgress, Sufficiency sufficiency)
    {
        this.version = Cfg.summaryVersion;
        this.stableIdsN = settings.stableIdsN;
        this.trackedIds = Collections.unmodifiableList(trackedIds);
        this.distanceRangeCm = Arrays.asList(settings.distanceMinCm, settings.distanceMaxCm);
        this.edgeMarginFrac = settings.edgeMarginFrac;
        this.goodCaptures = goodCaptures;
        this.targets = new Targets(settings);
        this.coverageGridCounts = Collections.unmodifiableMap(new LinkedHashMap<>(coverageGridCounts));
        this.coverageGridFilled = coverageGridFilled;
        this.perTagCaptureCount = Collections.unmodifiableMap(new LinkedHashMap<>(perTagCaptureCount));
        this.phaseProgress = phaseProgress;
        this.enough = sufficiency.isEnough();
        this.reasonsIfNotEnough = sufficiency.reasons();
    }

    public static final class Targets
    {
        public final int goodCaptures;
        public final int perTag;
        public final int gridFilled;
        public final boolean crossArchRequired;

        Targets(CaptureGuidanceSettings settings)
        {
            this.goodCaptures = settings.goodCapturesTarget;
            this.perTag = settings.perTagTarget;
            this.gridFilled = settings.gridTargetFilled;
            this.crossArchRequired = settings.crossArchRequired;
        }
    }

    public static final class PhaseProgress
    {
        public final Map<String, Integer> phaseA;
        @JsonProperty("phaseB_left")
        public final Map<String, Integer> phaseBLeft;
        @JsonProperty("phaseC_right")
        public final Map<String, Integer> phaseCRight;
        @JsonProperty("phaseD_crossArch")
        public final Map<String, Integer> phaseDCrossArch;

        PhaseProgress(Map<String, Integer> phaseA, Map<String, Integer> phaseBLeft, Map<String, Integer> phaseCRight,
            Map<String, Integer> phaseDCrossArch)
        {
            this.phaseA = Collections.unmodifiableMap(phaseA);
            this.phaseBLeft = Collections.unmodifiableMap(phaseBLeft);
            this.phaseCRight = Collections.unmodifiableMap(phaseCRight);
            this.phaseDCrossArch = Collections.unmodifiableMap(phaseDCrossArch);
        }
    }
}
