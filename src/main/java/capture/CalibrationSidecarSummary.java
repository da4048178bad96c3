package capture;

import java.util.Arrays;
import java.util.List;

/**
 * Marker block of the sidecar written next to each captured image of a calibration session
 */
public final class CalibrationSidecarSummary
{
    public final String mode;
    public final String dictionary;
    public final List<Integer> frameSize;
    public final boolean framingOk;
    public final Double distanceCm;
    public final boolean distanceOk;
    public final List<DetectionSummary> detections;

    CalibrationSidecarSummary(String dictionary, FrozenMarkerSnapshot marker, FrozenQualitySnapshot quality,
        boolean framingOk, boolean distanceOk)
    {
        this.mode = marker.mode().name();
        this.dictionary = dictionary;
        this.frameSize = Arrays.asList(marker.frameWidth(), marker.frameHeight());
        this.framingOk = framingOk;
        this.distanceCm = quality.distanceCm();
        this.distanceOk = distanceOk;
        this.detections = DetectionSummary.sorted(marker.detections(), marker.frameWidth(), marker.frameHeight());
    }
}
