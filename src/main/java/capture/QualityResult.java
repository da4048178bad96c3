package capture;

import java.util.Locale;

/**
 * Quality metrics of one analyzed frame. Immutable; one instance per analyzed frame.
 */
public final class QualityResult
{
    private static final QualityResult UNKNOWN = new QualityResult(QualityStatus.UNKNOWN, 0., 0., 0., 0, 0, null, 0L);

    private final QualityStatus status;
    private final double blurScore; // Laplacian variance over the ROI; lower is blurrier
    private final double overFraction; // clipped highlights fraction of sampled ROI pixels
    private final double underFraction; // clipped shadows fraction of sampled ROI pixels
    private final int specularClusterCount;
    private final int specularLargestCluster; // sampled pixels
    private final Double distanceCm; // null if not available
    private final long timestampNs;

    public QualityResult(QualityStatus status, double blurScore, double overFraction, double underFraction,
        int specularClusterCount, int specularLargestCluster, Double distanceCm, long timestampNs)
    {
        this.status = status;
        this.blurScore = blurScore;
        this.overFraction = overFraction;
        this.underFraction = underFraction;
        this.specularClusterCount = specularClusterCount;
        this.specularLargestCluster = specularLargestCluster;
        this.distanceCm = distanceCm;
        this.timestampNs = timestampNs;
    }

    /**
     * Placeholder published before the first frame is analyzed
     */
    public static QualityResult unknown()
    {
        return UNKNOWN;
    }

    public QualityStatus status()
    {
        return status;
    }
    public double blurScore()
    {
        return blurScore;
    }
    public double overFraction()
    {
        return overFraction;
    }
    public double underFraction()
    {
        return underFraction;
    }
    public int specularClusterCount()
    {
        return specularClusterCount;
    }
    public int specularLargestCluster()
    {
        return specularLargestCluster;
    }
    public Double distanceCm()
    {
        return distanceCm;
    }
    public long timestampNs()
    {
        return timestampNs;
    }

    @Override
    public String toString()
    {
        return String.format(Locale.US, "%s blur %.1f over %.4f under %.4f clusters %d/%d distance %s",
            status, blurScore, overFraction, underFraction, specularClusterCount, specularLargestCluster,
            distanceCm == null ? "n/a" : String.format(Locale.US, "%.1fcm", distanceCm));
    }
}
