package capture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One detection as written in a per capture sidecar
 */
public final class DetectionSummary
{
    public final long id;
    public final List<Double> centerPx;
    public final List<Double> centerNorm; // null without a frame size
    public final List<List<Double>> cornersPx;
    public final Double quality;

    DetectionSummary(TagDetection d, int frameWidth, int frameHeight)
    {
        this.id = d.id();
        this.centerPx = Arrays.asList(d.centerX(), d.centerY());
        this.centerNorm = frameWidth > 0 && frameHeight > 0
            ? Arrays.asList(d.centerX() / frameWidth, d.centerY() / frameHeight)
            : null;
        this.cornersPx = d.cornerList();
        this.quality = d.quality();
    }

    /**
     * @return summaries ordered by id, then center x, then center y
     */
    static List<DetectionSummary> sorted(List<TagDetection> detections, int frameWidth, int frameHeight)
    {
        List<TagDetection> ordered = new ArrayList<>(detections);
        ordered.sort(Comparator.comparingLong(TagDetection::id)
            .thenComparingDouble(TagDetection::centerX)
            .thenComparingDouble(TagDetection::centerY));

        List<DetectionSummary> list = new ArrayList<>(ordered.size());
        for (TagDetection d : ordered)
        {
            list.add(new DetectionSummary(d, frameWidth, frameHeight));
        }
        return Collections.unmodifiableList(list);
    }
}
