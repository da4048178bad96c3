package capture;

/**
 * Tunable geometry of the {@link FiducialMarkerDetector}; defaults from {@link Cfg}.
 */
public class MarkerSettings
{
    public double roiFrac = Cfg.markerRoiFrac;
    public int roiMinSide = Cfg.markerRoiMinSide;
    public int downsampleStep = Cfg.downsampleStep;
    public double edgeMarginFrac = Cfg.edgeMarginFrac;
    public String dictionaryName = Cfg.dictionaryName;

    public MarkerSettings copy()
    {
        MarkerSettings copy = new MarkerSettings();
        copy.roiFrac = roiFrac;
        copy.roiMinSide = roiMinSide;
        copy.downsampleStep = downsampleStep;
        copy.edgeMarginFrac = edgeMarginFrac;
        copy.dictionaryName = dictionaryName;
        return copy;
    }

    void validate()
    {
        if (roiFrac <= 0. || roiFrac > 1.)
        {
            throw new IllegalArgumentException("roiFrac must be in (0, 1] " + roiFrac);
        }
        if (downsampleStep < 1)
        {
            throw new IllegalArgumentException("downsampleStep must be at least 1 " + downsampleStep);
        }
        if (edgeMarginFrac < 0. || edgeMarginFrac >= 0.5)
        {
            throw new IllegalArgumentException("edgeMarginFrac must be in [0, 0.5) " + edgeMarginFrac);
        }
    }
}
