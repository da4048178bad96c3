package capture;

/**
 * Gates, targets and phase thresholds of a capture session; defaults from {@link Cfg}.
 */
public class CaptureGuidanceSettings
{
    public int stableIdsN = Cfg.stableIdsN;
    public double distanceMinCm = Cfg.distanceMinCm;
    public double distanceMaxCm = Cfg.distanceMaxCm;
    public double edgeMarginFrac = Cfg.edgeMarginFrac;
    public String dictionaryName = Cfg.dictionaryName;

    public int goodCapturesTarget = Cfg.captureGoodCapturesTarget;
    public int perTagTarget = Cfg.perTagTarget;
    public int gridTargetFilled = Cfg.captureGridTargetFilled;
    public boolean crossArchRequired = Cfg.crossArchRequired;

    public int anchorMidMin = Cfg.anchorMidMin;
    public int anchorHighLowMin = Cfg.anchorHighLowMin;
    public int sweepMidMin = Cfg.sweepMidMin;
    public int sweepHighLowMin = Cfg.sweepHighLowMin;
    public int crossArchTotalMin = Cfg.crossArchTotalMin;
    public int crossArchHighLowMin = Cfg.crossArchHighLowMin;
    public double crossArchSpreadMin = Cfg.crossArchSpreadMin;

    public CaptureGuidanceSettings copy()
    {
        CaptureGuidanceSettings copy = new CaptureGuidanceSettings();
        copy.stableIdsN = stableIdsN;
        copy.distanceMinCm = distanceMinCm;
        copy.distanceMaxCm = distanceMaxCm;
        copy.edgeMarginFrac = edgeMarginFrac;
        copy.dictionaryName = dictionaryName;
        copy.goodCapturesTarget = goodCapturesTarget;
        copy.perTagTarget = perTagTarget;
        copy.gridTargetFilled = gridTargetFilled;
        copy.crossArchRequired = crossArchRequired;
        copy.anchorMidMin = anchorMidMin;
        copy.anchorHighLowMin = anchorHighLowMin;
        copy.sweepMidMin = sweepMidMin;
        copy.sweepHighLowMin = sweepHighLowMin;
        copy.crossArchTotalMin = crossArchTotalMin;
        copy.crossArchHighLowMin = crossArchHighLowMin;
        copy.crossArchSpreadMin = crossArchSpreadMin;
        return copy;
    }

    void validate()
    {
        if (distanceMinCm > distanceMaxCm)
        {
            throw new IllegalArgumentException("distance range " + distanceMinCm + " > " + distanceMaxCm);
        }
        if (edgeMarginFrac < 0. || edgeMarginFrac >= 0.5)
        {
            throw new IllegalArgumentException("edgeMarginFrac must be in [0, 0.5) " + edgeMarginFrac);
        }
        if (stableIdsN < 0 || goodCapturesTarget < 0 || perTagTarget < 0 || gridTargetFilled < 0
            || gridTargetFilled > GuidanceGeometry.GRID_CELLS)
        {
            throw new IllegalArgumentException("negative target or grid target above " + GuidanceGeometry.GRID_CELLS);
        }
    }
}
