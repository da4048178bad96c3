package capture;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     GuidanceGeometry class                                      */
/*                                     GuidanceGeometry class                                      */
/*                                     GuidanceGeometry class                                      */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/**
 * Stateless coordinate normalization, binning and detection geometry shared by the marker adapter
 * and both guidance trackers.
 */
public final class GuidanceGeometry
{
    public enum LateralBin {LEFT, CENTER, RIGHT}
    public enum HeightBin {LOW, MID, HIGH}

    static final int GRID_CELLS = 9; // 3x3 row major

    private GuidanceGeometry()
    {
        throw new UnsupportedOperationException("This is a utility class");
    }

    public static double clamp01(double v)
    {
        return Math.max(0., Math.min(1., v));
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     lateralBin heightBin                                        */
/*                                     lateralBin heightBin                                        */
/*                                     lateralBin heightBin                                        */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * @param xNorm horizontal position [0, 1]
     * @return LEFT below 0.33, RIGHT above 0.66, else CENTER
     */
    public static LateralBin lateralBin(double xNorm)
    {
        if (xNorm < 0.33) return LateralBin.LEFT;
        if (xNorm > 0.66) return LateralBin.RIGHT;
        return LateralBin.CENTER;
    }

    /**
     * @param yNorm vertical position [0, 1] measured from the top of the frame
     * @return LOW below 0.33, HIGH above 0.66, else MID
     */
    public static HeightBin heightBin(double yNorm)
    {
        if (yNorm < 0.33) return HeightBin.LOW;
        if (yNorm > 0.66) return HeightBin.HIGH;
        return HeightBin.MID;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     gridIndex3x3                                                */
/*                                     gridIndex3x3                                                */
/*                                     gridIndex3x3                                                */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Cell of a normalized point in the 3x3 grid; columns and rows are the half-open intervals
     * [0, 0.333333), [0.333333, 0.666666), [0.666666, 1].
     *
     * @return row * 3 + column, 0..8
     */
    public static int gridIndex3x3(double xNorm, double yNorm)
    {
        return gridThird(yNorm) * 3 + gridThird(xNorm);
    }

    private static int gridThird(double norm)
    {
        if (norm < 0.333333) return 0;
        if (norm < 0.666666) return 1;
        return 2;
    }

    public static int filledGridCells(int[] counts)
    {
        int filled = 0;
        for (int count : counts)
        {
            if (count > 0) filled++;
        }
        return filled;
    }

    /**
     * @return lowest index of a cell with no captures, or -1 if every cell has some
     */
    public static int firstEmptyGridCell(int[] counts)
    {
        for (int i = 0; i < counts.length; i++)
        {
            if (counts[i] <= 0) return i;
        }
        return -1;
    }

    /**
     * @return operator name of a grid cell, e.g. "top-left", "mid-center", "bottom-right"
     */
    public static String cellName(int index)
    {
        final String[] rowNames = {"top", "mid", "bottom"};
        final String[] colNames = {"left", "center", "right"};
        return rowNames[index / 3] + "-" + colNames[index % 3];
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     meanCenterNorm                                              */
/*                                     meanCenterNorm                                              */
/*                                     meanCenterNorm                                              */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Mean of the detection centers normalized to the frame and clamped to [0, 1].
     *
     * @return {xNorm, yNorm} or null if there are no detections or no frame size
     */
    public static double[] meanCenterNorm(List<TagDetection> detections, int width, int height)
    {
        if (detections.isEmpty() || width <= 0 || height <= 0)
        {
            return null;
        }
        double sx = 0.;
        double sy = 0.;
        for (TagDetection d : detections)
        {
            sx += d.centerX();
            sy += d.centerY();
        }
        return new double[] {
            clamp01(sx / detections.size() / width),
            clamp01(sy / detections.size() / height)};
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     spreadXNorm hasBothSides                                    */
/*                                     spreadXNorm hasBothSides                                    */
/*                                     spreadXNorm hasBothSides                                    */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Horizontal extent of the detection centers as a fraction of the frame width
     */
    public static double spreadXNorm(List<TagDetection> detections, int width)
    {
        if (detections.isEmpty() || width <= 0)
        {
            return 0.;
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (TagDetection d : detections)
        {
            minX = Math.min(minX, d.centerX());
            maxX = Math.max(maxX, d.centerX());
        }
        return clamp01((maxX - minX) / width);
    }

    /**
     * @return true if some detection is in the left third and some in the right third of the frame
     */
    public static boolean hasBothSides(List<TagDetection> detections, int width)
    {
        if (detections.isEmpty() || width <= 0)
        {
            return false;
        }
        boolean left = false;
        boolean right = false;
        for (TagDetection d : detections)
        {
            double xNorm = clamp01(d.centerX() / width);
            if (xNorm < 0.33) left = true;
            if (xNorm > 0.66) right = true;
        }
        return left && right;
    }

    /**
     * Wide baseline view: detections spread over at least {@code spreadMin} of the width and
     * present on both sides at once.
     */
    public static boolean isCrossArch(List<TagDetection> detections, int width, double spreadMin)
    {
        return spreadXNorm(detections, width) >= spreadMin && hasBothSides(detections, width);
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     framingOk                                                   */
/*                                     framingOk                                                   */
/*                                     framingOk                                                   */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Every detection corner (or the center if a detection has no corners) must be at least
     * {@code edgeMarginFrac} of the width/height away from each frame edge.
     *
     * @return true if nothing is too near an edge; vacuously true with no detections
     */
    public static boolean framingOk(List<TagDetection> detections, int width, int height, double edgeMarginFrac)
    {
        final double mx = width * edgeMarginFrac;
        final double my = height * edgeMarginFrac;
        for (TagDetection d : detections)
        {
            if (d.hasCorners())
            {
                for (int i = 0; i < d.cornerCount(); i++)
                {
                    if ( ! inside(d.cornerX(i), d.cornerY(i), width, height, mx, my)) return false;
                }
            }
            else
            {
                if ( ! inside(d.centerX(), d.centerY(), width, height, mx, my)) return false;
            }
        }
        return true;
    }

    private static boolean inside(double x, double y, int width, int height, double mx, double my)
    {
        return x >= mx && x <= width - mx && y >= my && y <= height - my;
    }
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     chooseStableIds                                             */
/*                                     chooseStableIds                                             */
/*                                     chooseStableIds                                             */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
    /**
     * Pick the most frequently seen identities from a running tally.
     *
     * @param tally per identity visibility count
     * @param n how many to pick
     * @return min(n, distinct ids) ids by descending count then ascending id
     */
    public static List<Long> chooseStableIds(Map<Long, Long> tally, int n)
    {
        List<Map.Entry<Long, Long>> entries = new ArrayList<>(tally.entrySet());
        entries.sort(Comparator.<Map.Entry<Long, Long>>comparingLong(Map.Entry::getValue).reversed()
            .thenComparingLong(Map.Entry::getKey));

        int take = Math.min(Math.max(0, n), entries.size());
        List<Long> ids = new ArrayList<>(take);
        for (int i = 0; i < take; i++)
        {
            ids.add(entries.get(i).getKey());
        }
        return ids;
    }
}
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
/*                                                                                                 */
/*                                     End GuidanceGeometry class                                  */
/*                                     End GuidanceGeometry class                                  */
/*                                     End GuidanceGeometry class                                  */
/*                                                                                                 */
/*-------------------------------------------------------------------------------------------------*/
/*-------------------------------------------------------------------------------------------------*/
