package capture;

/**
 * How marker detection takes part in capturing.
 */
public enum MarkerMode
{
    OFF, // no detection work; status only shows the pipeline is alive
    WARN, // guidance shown, capture always allowed
    BLOCK // guidance shown, caller refuses captures with a block reason
}
