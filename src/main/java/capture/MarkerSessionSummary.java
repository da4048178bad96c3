package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Copy of a marker detector's session counters.
 */
public final class MarkerSessionSummary
{
    private final long framesProcessed;
    private final long framesAllRequiredVisible;
    private final Map<Long, Long> perTagCount; // ascending id
    private final List<Long> requiredIds;

    public MarkerSessionSummary(long framesProcessed, long framesAllRequiredVisible, Map<Long, Long> perTagCount,
        List<Long> requiredIds)
    {
        this.framesProcessed = framesProcessed;
        this.framesAllRequiredVisible = framesAllRequiredVisible;
        this.perTagCount = Collections.unmodifiableMap(new TreeMap<>(perTagCount));
        this.requiredIds = Collections.unmodifiableList(new ArrayList<>(requiredIds));
    }

    public static MarkerSessionSummary empty()
    {
        return new MarkerSessionSummary(0L, 0L, Collections.emptyMap(), Collections.emptyList());
    }

    public long framesProcessed()
    {
        return framesProcessed;
    }
    public long framesAllRequiredVisible()
    {
        return framesAllRequiredVisible;
    }
    /**
     * @return frames in which each identity was seen, by ascending identity
     */
    public Map<Long, Long> perTagCount()
    {
        return perTagCount;
    }
    public List<Long> requiredIds()
    {
        return requiredIds;
    }

    /**
     * Most frequently seen identities of the session
     *
     * @see GuidanceGeometry#chooseStableIds(Map, int)
     */
    public List<Long> stableCandidates(int n)
    {
        return GuidanceGeometry.chooseStableIds(perTagCount, n);
    }

    @Override
    public String toString()
    {
        return "frames " + framesProcessed + ", all required visible " + framesAllRequiredVisible
            + ", per tag " + perTagCount;
    }
}
