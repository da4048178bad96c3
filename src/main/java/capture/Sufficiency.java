package capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Whether a session has enough captures, and if not, why; reasons are in a fixed order.
 */
public final class Sufficiency
{
    private final List<String> reasons;

    Sufficiency(List<String> reasons)
    {
        this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
    }

    public boolean isEnough()
    {
        return reasons.isEmpty();
    }

    /**
     * @return unmet conditions, empty when enough
     */
    public List<String> reasons()
    {
        return reasons;
    }

    @Override
    public String toString()
    {
        return isEnough() ? "enough" : "not enough " + reasons;
    }
}
