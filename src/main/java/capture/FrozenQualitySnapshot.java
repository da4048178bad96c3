package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Quality verdict frozen at the moment of a capture
 */
public final class FrozenQualitySnapshot
{
    private final QualityStatus status;
    private final double blurScore;
    private final List<String> exposureFlags;
    private final Double distanceCm;

    public FrozenQualitySnapshot(QualityStatus status, double blurScore, List<String> exposureFlags, Double distanceCm)
    {
        this.status = status;
        this.blurScore = blurScore;
        this.exposureFlags = Collections.unmodifiableList(new ArrayList<>(exposureFlags));
        this.distanceCm = distanceCm;
    }

    /**
     * @param result latest analyzer result; null is treated as {@link QualityStatus#UNKNOWN}
     */
    public static FrozenQualitySnapshot from(QualityResult result)
    {
        QualityResult q = result != null ? result : QualityResult.unknown();
        return new FrozenQualitySnapshot(q.status(), q.blurScore(), exposureFlags(q.status()), q.distanceCm());
    }

    static List<String> exposureFlags(QualityStatus status)
    {
        List<String> flags = new ArrayList<>(1);
        if (status == QualityStatus.OVER) flags.add("OVER");
        if (status == QualityStatus.UNDER) flags.add("UNDER");
        if (status == QualityStatus.SPECULAR) flags.add("SPECULAR");
        return flags;
    }

    public QualityStatus status()
    {
        return status;
    }
    public double blurScore()
    {
        return blurScore;
    }
    public List<String> exposureFlags()
    {
        return exposureFlags;
    }
    public Double distanceCm()
    {
        return distanceCm;
    }

    @Override
    public String toString()
    {
        return status + " blur " + Math.round(blurScore) + " " + exposureFlags
            + (distanceCm == null ? "" : " " + Math.round(distanceCm) + "cm");
    }
}
