package capture;

import java.util.List;

/**
 * Fiducial detection on a reduced, tightly packed 8 bit gray buffer.
 *
 * Coordinates of the returned detections are in the reduced buffer's pixel space; the adapter maps
 * them back to the full frame. Implementations may throw; the adapter treats that as no detections.
 */
@FunctionalInterface
public interface TagDetectorEngine
{
    List<TagDetection> detect(byte[] gray, int width, int height);
}
