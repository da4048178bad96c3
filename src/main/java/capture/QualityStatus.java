package capture;

/**
 * Verdict of one analyzed frame, listed in classification priority after UNKNOWN.
 */
public enum QualityStatus
{
    UNKNOWN, // nothing analyzed yet
    BLUR,
    OVER,
    SPECULAR, // a few small clipped highlights; tolerated by the UI but not a good capture
    UNDER,
    OK
}
