package capture;

/**
 * Capture session phases in the order they are completed
 */
public enum CapturePhase
{
    ANCHOR("Next: anchor ring (front/left/right + high/low)"),
    LEFT_SWEEP("Next: sweep LEFT posterior (upper+lower rail)"),
    RIGHT_SWEEP("Next: sweep RIGHT posterior (upper+lower rail)"),
    CROSS_ARCH("Next: cross-arch obliques (high+low)"),
    CLEANUP("Cleanup");

    private final String hint;

    CapturePhase(String hint)
    {
        this.hint = hint;
    }

    /** what the operator should capture in this phase */
    public String hint()
    {
        return hint;
    }
}
