package capture;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Latest per-frame camera metadata, written by the camera callback thread and read by anyone.
 * 
 * Each value is swapped atomically; {@link #snapshot()} gives an immutable copy for a capture.
 */
public class LensMetadataStore implements FocusDistanceSource
{
    private static final Logger LOGGER = Logger.getLogger(LensMetadataStore.class.getName());

    private final AtomicReference<Integer> iso = new AtomicReference<>(null);
    private final AtomicReference<Long> exposureNs = new AtomicReference<>(null);
    private final AtomicReference<Float> focusDistanceDiopters = new AtomicReference<>(null);

    /**
     * Record the metadata of a completed camera frame. Any value may be null if the device did not report it.
     */
    public void onFrameMetadata(Integer iso, Long exposureNs, Float focusDistanceDiopters)
    {
        this.iso.set(iso);
        this.exposureNs.set(exposureNs);
        this.focusDistanceDiopters.set(focusDistanceDiopters);
        LOGGER.finest("iso " + iso + " exposure " + exposureNs + "ns focus " + focusDistanceDiopters + "D");
    }

    public Integer latestIso()
    {
        return iso.get();
    }

    public Long latestExposureNs()
    {
        return exposureNs.get();
    }

    @Override
    public Float latestFocusDistanceDiopters()
    {
        return focusDistanceDiopters.get();
    }

    public Snapshot snapshot()
    {
        return new Snapshot(iso.get(), exposureNs.get(), focusDistanceDiopters.get());
    }

    /**
     * Metadata frozen at capture time; no re-querying of the camera.
     */
    public static final class Snapshot
    {
        private final Integer iso;
        private final Long exposureNs;
        private final Float focusDistanceDiopters;

        Snapshot(Integer iso, Long exposureNs, Float focusDistanceDiopters)
        {
            this.iso = iso;
            this.exposureNs = exposureNs;
            this.focusDistanceDiopters = focusDistanceDiopters;
        }

        public Integer iso()
        {
            return iso;
        }
        public Long exposureNs()
        {
            return exposureNs;
        }
        public Float focusDistanceDiopters()
        {
            return focusDistanceDiopters;
        }
    }
}
