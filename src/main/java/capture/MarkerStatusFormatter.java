package capture;

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Operator facing text for marker and lens status. Pure functions of their arguments.
 */
public final class MarkerStatusFormatter
{
    private MarkerStatusFormatter()
    {
        throw new UnsupportedOperationException("This is a utility class");
    }

    /**
     * What the operator should do next about the markers in view.
     *
     * @param total number of detections in the frame
     * @param required required identities, sorted
     * @param missing required identities not detected, in required order
     * @param framingOk no detection too near a frame edge
     */
    public static String guidanceText(int total, List<Long> required, List<Long> missing, boolean framingOk)
    {
        if (total == 0)
        {
            return "No markers detected";
        }
        if ( ! required.isEmpty() && ! missing.isEmpty())
        {
            return "Missing required: " + StringUtils.join(missing, ",");
        }
        if ( ! framingOk)
        {
            return "Reframe: keep tags away from edges";
        }
        return "Markers OK";
    }

    /**
     * Short status line, e.g. "Markers: 5 | required 2/3 | edge"
     */
    public static String displayText(int total, List<Long> required, List<Long> missing, boolean framingOk)
    {
        StringBuilder text = new StringBuilder("Markers: ").append(total);
        if ( ! required.isEmpty())
        {
            text.append(" | required ").append(required.size() - missing.size()).append('/').append(required.size());
        }
        if ( ! framingOk)
        {
            text.append(" | edge");
        }
        return text.toString();
    }

    /**
     * @param diopters lens focus distance, 1/m; null if the camera does not report it
     * @return "fd=—" unknown, "fd=∞" focused at infinity, else "fd≈25cm (4.00D)"
     */
    public static String formatFocusDistance(Float diopters)
    {
        if (diopters == null)
        {
            return "fd=—";
        }
        if (diopters <= 0f)
        {
            return "fd=∞";
        }
        int cm = Math.round(100f / diopters);
        return "fd≈" + cm + "cm (" + String.format(Locale.US, "%.2fD", diopters) + ")";
    }
}
