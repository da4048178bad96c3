package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Marker status frozen at the moment of a capture; what the guidance trackers count.
 */
public final class FrozenMarkerSnapshot
{
    private final long timestampNs;
    private final MarkerMode mode;
    private final int frameWidth;
    private final int frameHeight;
    private final List<Long> requiredIds;
    private final List<Long> detectedIds;
    private final List<Long> missingRequiredIds;
    private final boolean allRequiredVisible;
    private final boolean framingOk;
    private final List<TagDetection> detections;

    public FrozenMarkerSnapshot(long timestampNs, MarkerMode mode, int frameWidth, int frameHeight,
        List<Long> requiredIds, List<Long> detectedIds, List<Long> missingRequiredIds,
        boolean allRequiredVisible, boolean framingOk, List<TagDetection> detections)
    {
        this.timestampNs = timestampNs;
        this.mode = mode;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.requiredIds = Collections.unmodifiableList(new ArrayList<>(requiredIds));
        this.detectedIds = Collections.unmodifiableList(new ArrayList<>(detectedIds));
        this.missingRequiredIds = Collections.unmodifiableList(new ArrayList<>(missingRequiredIds));
        this.allRequiredVisible = allRequiredVisible;
        this.framingOk = framingOk;
        this.detections = Collections.unmodifiableList(new ArrayList<>(detections));
    }

    public static FrozenMarkerSnapshot from(MarkerStatus status)
    {
        return new FrozenMarkerSnapshot(status.timestampNs(), status.mode(), status.frameWidth(), status.frameHeight(),
            status.requiredIds(), status.detectedIds(), status.missingRequiredIds(),
            status.allRequiredVisible(), status.framingOk(), status.detections());
    }

    /**
     * Snapshot of detections not coming from a {@link MarkerDetector}, such as a stored capture;
     * the derived fields are computed here with the default edge margin.
     */
    public static FrozenMarkerSnapshot of(MarkerMode mode, int frameWidth, int frameHeight, List<Long> requiredIds,
        List<TagDetection> detections)
    {
        List<Long> required = FiducialMarkerDetector.normalizeIds(requiredIds);
        List<Long> detected = new ArrayList<>(detections.size());
        Set<Long> present = new HashSet<>();
        for (TagDetection d : detections)
        {
            detected.add(d.id());
            present.add(d.id());
        }
        List<Long> missing = new ArrayList<>();
        for (Long id : required)
        {
            if ( ! present.contains(id)) missing.add(id);
        }
        boolean framingOk = GuidanceGeometry.framingOk(detections, frameWidth, frameHeight, Cfg.edgeMarginFrac);
        return new FrozenMarkerSnapshot(0L, mode, frameWidth, frameHeight, required, detected, missing,
            missing.isEmpty(), framingOk, detections);
    }

    public long timestampNs()
    {
        return timestampNs;
    }
    public MarkerMode mode()
    {
        return mode;
    }
    public int frameWidth()
    {
        return frameWidth;
    }
    public int frameHeight()
    {
        return frameHeight;
    }
    public List<Long> requiredIds()
    {
        return requiredIds;
    }
    public List<Long> detectedIds()
    {
        return detectedIds;
    }
    public List<Long> missingRequiredIds()
    {
        return missingRequiredIds;
    }
    public boolean allRequiredVisible()
    {
        return allRequiredVisible;
    }
    public boolean framingOk()
    {
        return framingOk;
    }
    public List<TagDetection> detections()
    {
        return detections;
    }

    @Override
    public String toString()
    {
        return mode + " " + frameWidth + "x" + frameHeight + " detected " + detectedIds + " missing " + missingRequiredIds
            + (framingOk ? "" : " near edge");
    }
}
