package capture;

/**
 * Gates and targets of a calibration session; defaults from {@link Cfg}.
 */
public class CalibrationGuidanceSettings
{
    public double distanceTargetCm = Cfg.calibrationDistanceTargetCm;
    public double distanceMinCm = Cfg.distanceMinCm;
    public double distanceMaxCm = Cfg.distanceMaxCm;
    public double edgeMarginFrac = Cfg.edgeMarginFrac;
    public String dictionaryName = Cfg.dictionaryName;
    public int goodCapturesTarget = Cfg.calibrationGoodCapturesTarget;
    public int gridTargetFilled = Cfg.calibrationGridTargetFilled;

    public CalibrationGuidanceSettings copy()
    {
        CalibrationGuidanceSettings copy = new CalibrationGuidanceSettings();
        copy.distanceTargetCm = distanceTargetCm;
        copy.distanceMinCm = distanceMinCm;
        copy.distanceMaxCm = distanceMaxCm;
        copy.edgeMarginFrac = edgeMarginFrac;
        copy.dictionaryName = dictionaryName;
        copy.goodCapturesTarget = goodCapturesTarget;
        copy.gridTargetFilled = gridTargetFilled;
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
        if (goodCapturesTarget < 0 || gridTargetFilled < 0 || gridTargetFilled > GuidanceGeometry.GRID_CELLS)
        {
            throw new IllegalArgumentException("negative target or grid target above " + GuidanceGeometry.GRID_CELLS);
        }
    }
}
