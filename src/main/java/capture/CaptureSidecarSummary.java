package capture;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Marker block of the sidecar written next to each captured image of a capture session
 */
public final class CaptureSidecarSummary
{
    public final String mode;
    public final String dictionary;
    public final List<Integer> frameSize;
    public final List<Long> requiredIds;
    public final List<Long> trackedIds;
    public final List<Long> missingRequiredIds;
    public final List<Long> detectedIds; // ascending
    public final boolean allRequiredVisible;
    public final boolean framingOk;
    public final Double distanceCm;
    public final boolean distanceOk;
    public final String phase;
    public final Integer gridCell;
    public final String lateralBin;
    public final String heightBin;
    public final boolean crossArch;
    public final List<DetectionSummary> detections;

    CaptureSidecarSummary(String dictionary, FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality,
        List<Long> trackedIds, List<Long> detectedIdsSorted, boolean framingOk, boolean distanceOk, CapturePhase phase,
        Integer gridCell, String lateralBin, String heightBin, boolean crossArch)
    {
        this.mode = marker.mode().name();
        this.dictionary = dictionary;
        this.frameSize = Arrays.asList(marker.frameWidth(), marker.frameHeight());
        this.requiredIds = marker.requiredIds();
        this.trackedIds = Collections.unmodifiableList(trackedIds);
        this.missingRequiredIds = marker.missingRequiredIds();
        this.detectedIds = Collections.unmodifiableList(detectedIdsSorted);
        this.allRequiredVisible = marker.allRequiredVisible();
        this.framingOk = framingOk;
        this.distanceCm = quality.distanceCm();
        this.distanceOk = distanceOk;
        this.phase = phase.name();
        this.gridCell = gridCell;
        this.lateralBin = lateralBin;
        this.heightBin = heightBin;
        this.crossArch = crossArch;
        this.detections = DetectionSummary.sorted(marker.detections(), marker.frameWidth(), marker.frameHeight());
    }
}
