package capture;

/**
 * What to show the operator for the current frame of a capture session
 */
public final class CaptureLiveGuidance
{
    private final String message;
    private final CapturePhase phase;
    private final String phaseProgress;
    private final String coverageText;
    private final boolean enough;
    private final String blockReason;

    CaptureLiveGuidance(String message, CapturePhase phase, String phaseProgress, String coverageText, boolean enough,
        String blockReason)
    {
        this.message = message;
        this.phase = phase;
        this.phaseProgress = phaseProgress;
        this.coverageText = coverageText;
        this.enough = enough;
        this.blockReason = blockReason;
    }

    public String message()
    {
        return message;
    }
    public CapturePhase phase()
    {
        return phase;
    }
    public String phaseProgress()
    {
        return phaseProgress;
    }
    public String coverageText()
    {
        return coverageText;
    }
    public boolean enough()
    {
        return enough;
    }
    /**
     * @return why a capture must be refused in BLOCK mode, null if it may proceed
     */
    public String blockReason()
    {
        return blockReason;
    }
    public boolean isBlocked()
    {
        return blockReason != null;
    }

    @Override
    public String toString()
    {
        return message + " | " + phaseProgress + " | " + coverageText + (blockReason == null ? "" : " | blocked: " + blockReason);
    }
}
