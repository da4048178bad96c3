package capture;

import java.util.List;

/**
 * Marker detection not available; reports "N/A" and does nothing.
 */
public class DisabledMarkerDetector implements MarkerDetector
{
    private static final MarkerStatus NOT_ENABLED = MarkerStatus.notEnabled();

    @Override
    public void process(RawFrame frame)
    {
        // not enabled
    }

    @Override
    public MarkerStatus latest()
    {
        return NOT_ENABLED;
    }

    @Override
    public void setMode(MarkerMode mode)
    {
        // not enabled
    }

    @Override
    public void setRequiredIdentities(List<Long> ids)
    {
        // not enabled
    }

    @Override
    public void reset()
    {
        // nothing to reset
    }

    @Override
    public MarkerSessionSummary sessionSummary()
    {
        return MarkerSessionSummary.empty();
    }
}
