package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Marker detection result of one frame as published by a {@link MarkerDetector}. Immutable; a new
 * instance is swapped in per processed frame.
 */
public final class MarkerStatus
{
    private final boolean enabled;
    private final long timestampNs;
    private final MarkerMode mode;
    private final int frameWidth;
    private final int frameHeight;
    private final List<TagDetection> detections;
    private final List<Long> requiredIds;
    private final List<Long> missingRequiredIds;
    private final boolean allRequiredVisible;
    private final boolean framingOk;
    private final String guidanceText;
    private final String displayText;

    MarkerStatus(boolean enabled, long timestampNs, MarkerMode mode, int frameWidth, int frameHeight,
        List<TagDetection> detections, List<Long> requiredIds, List<Long> missingRequiredIds,
        boolean allRequiredVisible, boolean framingOk, String guidanceText, String displayText)
    {
        this.enabled = enabled;
        this.timestampNs = timestampNs;
        this.mode = mode;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.detections = Collections.unmodifiableList(new ArrayList<>(detections));
        this.requiredIds = Collections.unmodifiableList(new ArrayList<>(requiredIds));
        this.missingRequiredIds = Collections.unmodifiableList(new ArrayList<>(missingRequiredIds));
        this.allRequiredVisible = allRequiredVisible;
        this.framingOk = framingOk;
        this.guidanceText = guidanceText;
        this.displayText = displayText;
    }

    /**
     * Status of a detector that is not available at all
     */
    static MarkerStatus notEnabled()
    {
        return new MarkerStatus(false, 0L, MarkerMode.OFF, 0, 0,
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
            true, true, "", "Markers detected: N/A");
    }

    /**
     * Status before any frame of a session, or of a frame not examined in OFF mode
     */
    static MarkerStatus idle(long timestampNs, MarkerMode mode, int frameWidth, int frameHeight, List<Long> requiredIds)
    {
        return new MarkerStatus(true, timestampNs, mode, frameWidth, frameHeight,
            Collections.emptyList(), requiredIds, requiredIds,
            requiredIds.isEmpty(), true, "",
            mode == MarkerMode.OFF ? "Markers: off" : "Markers: waiting");
    }

    /**
     * Status of a frame whose pixel layout the detector cannot read
     */
    static MarkerStatus unsupported(long timestampNs, MarkerMode mode, int frameWidth, int frameHeight, List<Long> requiredIds)
    {
        return new MarkerStatus(true, timestampNs, mode, frameWidth, frameHeight,
            Collections.emptyList(), requiredIds, requiredIds,
            requiredIds.isEmpty(), true, "Unsupported format", "Markers: unsupported format");
    }

    public boolean isEnabled()
    {
        return enabled;
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
    public List<TagDetection> detections()
    {
        return detections;
    }
    public List<Long> requiredIds()
    {
        return requiredIds;
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
    public String guidanceText()
    {
        return guidanceText;
    }
    public String displayText()
    {
        return displayText;
    }

    public int detectedCount()
    {
        return detections.size();
    }

    /**
     * @return identities in detection order; a tag seen twice is listed twice
     */
    public List<Long> detectedIds()
    {
        List<Long> ids = new ArrayList<>(detections.size());
        for (TagDetection d : detections)
        {
            ids.add(d.id());
        }
        return ids;
    }

    @Override
    public String toString()
    {
        return mode + " " + frameWidth + "x" + frameHeight + " " + displayText
            + (guidanceText.isEmpty() ? "" : " / " + guidanceText);
    }
}
