package capture;

/**
 * Tunable thresholds of the {@link QualityAnalyzer}; defaults from {@link Cfg}.
 */
public class QualitySettings
{
    public int targetFps = Cfg.targetFps;
    public double roiFrac = Cfg.qualityRoiFrac;
    public int roiMinSide = Cfg.qualityRoiMinSide;
    public double blurThreshold = Cfg.blurThreshold;
    public int clipHigh = Cfg.clipHigh;
    public int clipLow = Cfg.clipLow;
    public double overThresh = Cfg.overThresh;
    public double underThresh = Cfg.underThresh;
    public int specularMaxClusters = Cfg.specularMaxClusters;
    public int specularMaxClusterSize = Cfg.specularMaxClusterSize;

    public QualitySettings copy()
    {
        QualitySettings copy = new QualitySettings();
        copy.targetFps = targetFps;
        copy.roiFrac = roiFrac;
        copy.roiMinSide = roiMinSide;
        copy.blurThreshold = blurThreshold;
        copy.clipHigh = clipHigh;
        copy.clipLow = clipLow;
        copy.overThresh = overThresh;
        copy.underThresh = underThresh;
        copy.specularMaxClusters = specularMaxClusters;
        copy.specularMaxClusterSize = specularMaxClusterSize;
        return copy;
    }

    void validate()
    {
        if (roiFrac <= 0. || roiFrac > 1.)
        {
            throw new IllegalArgumentException("roiFrac must be in (0, 1] " + roiFrac);
        }
        if (clipLow < 0 || clipHigh > 255 || clipLow >= clipHigh)
        {
            throw new IllegalArgumentException("bad clip levels low " + clipLow + " high " + clipHigh);
        }
    }
}
