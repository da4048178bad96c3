package capture;

/**
 * Best-effort lens focus distance reported by the camera metadata collaborator.
 */
@FunctionalInterface
public interface FocusDistanceSource
{
    /**
     * @return latest focus distance in diopters (1/m), or null if never reported
     */
    Float latestFocusDistanceDiopters();
}
