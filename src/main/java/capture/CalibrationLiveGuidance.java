package capture;

/**
 * What to show the operator for the current frame of a calibration session
 */
public final class CalibrationLiveGuidance
{
    private final String message;
    private final String progress;
    private final String coverageText;
    private final boolean enough;

    CalibrationLiveGuidance(String message, String progress, String coverageText, boolean enough)
    {
        this.message = message;
        this.progress = progress;
        this.coverageText = coverageText;
        this.enough = enough;
    }

    public String message()
    {
        return message;
    }
    public String progress()
    {
        return progress;
    }
    public String coverageText()
    {
        return coverageText;
    }
    public boolean enough()
    {
        return enough;
    }

    @Override
    public String toString()
    {
        return message + " | " + progress + " | " + coverageText;
    }
}
