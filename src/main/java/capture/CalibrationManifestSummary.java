package capture;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session level summary of a calibration session for the manifest
 */
public final class CalibrationManifestSummary
{
    public final int version;
    public final double distanceTargetCm;
    public final List<Double> distanceRangeCm;
    public final double edgeMarginFrac;
    public final int goodCaptures;
    public final Targets targets;
    public final Map<String, Integer> coverageGridCounts;
    public final int coverageGridFilled;
    public final boolean enough;
    public final List<String> reasonsIfNotEnough;

    CalibrationManifestSummary(CalibrationGuidanceSettings settings, int goodCaptures,
        Map<String, Integer> coverageGridCounts, int coverageGridFilled, Sufficiency sufficiency)
    {
        this.version = Cfg.summaryVersion;
        this.distanceTargetCm = settings.distanceTargetCm;
        this.distanceRangeCm = Arrays.asList(settings.distanceMinCm, settings.distanceMaxCm);
        this.edgeMarginFrac = settings.edgeMarginFrac;
        this.goodCaptures = goodCaptures;
        this.targets = new Targets(settings);
        this.coverageGridCounts = Collections.unmodifiableMap(new LinkedHashMap<>(coverageGridCounts));
        this.coverageGridFilled = coverageGridFilled;
        this.enough = sufficiency.isEnough();
        this.reasonsIfNotEnough = sufficiency.reasons();
    }

    public static final class Targets
    {
        public final int goodCaptures;
        public final int gridFilled;

        Targets(CalibrationGuidanceSettings settings)
        {
            this.goodCaptures = settings.goodCapturesTarget;
            this.gridFilled = settings.gridTargetFilled;
        }
    }
}
