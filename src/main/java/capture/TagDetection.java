package capture;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One fiducial found in one frame, in full-frame pixel coordinates. Immutable.
 */
public final class TagDetection
{
    // The decoded identity of the tag
    private final long id;

    // The center of the detection in image pixel coordinates.
    private final double centerX;
    private final double centerY;

    // The corners of the tag in detector order, flattened to [x0 y0 x1 y1 ...]; empty if not reported
    private final double[] corners;

    // polygon area quality proxy [0, 1]; null if not computed
    private final Double quality;

    public TagDetection(long id, double centerX, double centerY, double[] corners, Double quality)
    {
        if (corners != null && corners.length != 0 && (corners.length % 2 != 0 || corners.length < 8))
        {
            throw new IllegalArgumentException("corners must be at least 4 (x, y) pairs, got " + corners.length + " values");
        }
        this.id = id;
        this.centerX = centerX;
        this.centerY = centerY;
        this.corners = corners == null ? new double[0] : corners.clone();
        this.quality = quality;
    }

    public TagDetection(long id, double centerX, double centerY)
    {
        this(id, centerX, centerY, null, null);
    }

    public long id()
    {
        return id;
    }
    public double centerX()
    {
        return centerX;
    }
    public double centerY()
    {
        return centerY;
    }
    public Double quality()
    {
        return quality;
    }
    public boolean hasCorners()
    {
        return corners.length > 0;
    }
    public int cornerCount()
    {
        return corners.length / 2;
    }
    public double cornerX(int i)
    {
        return corners[2 * i];
    }
    public double cornerY(int i)
    {
        return corners[2 * i + 1];
    }

    /**
     * @return copy of the flattened corners [x0 y0 x1 y1 ...]
     */
    public double[] cornersFlat()
    {
        return corners.clone();
    }

    /**
     * @return corners as [x, y] pairs for summaries
     */
    public List<List<Double>> cornerList()
    {
        List<List<Double>> list = new ArrayList<>(cornerCount());
        for (int i = 0; i < cornerCount(); i++)
        {
            list.add(Arrays.asList(cornerX(i), cornerY(i)));
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public String toString()
    {
        return "tag " + id + " (" + Math.round(centerX) + ", " + Math.round(centerY) + ")"
            + (quality == null ? "" : String.format(Locale.US, " q %.3f", quality));
    }
}
