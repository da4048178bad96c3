package capture;

import java.util.List;

/**
 * Marker detection capability as seen by the frame pipeline and the UI.
 *
 * {@link #process(RawFrame)} is called by the single frame processing thread; {@link #latest()} and
 * {@link #sessionSummary()} may be called from any thread and never observe a partial update.
 */
public interface MarkerDetector
{
    /**
     * Detect markers in the frame and publish a new status.
     * Do not keep the frame; the frame source owns its buffer.
     */
    void process(RawFrame frame);

    /** Latest status for UI */
    MarkerStatus latest();

    void setMode(MarkerMode mode);

    /**
     * @param ids identities the operator requires in view; duplicates are ignored
     */
    void setRequiredIdentities(List<Long> ids);

    /** Reset session counters between sessions */
    void reset();

    /** Copy of the session-wide counters */
    MarkerSessionSummary sessionSummary();
}
