package capture;

import java.util.Objects;

/**
 * View of one camera frame's luma plane.
 * 
 * The buffer belongs to the frame source; analyzers read it during a single call and never keep it.
 * Pixel (x, y) lives at {@code y * rowStride + x * pixelStride}.
 */
public final class RawFrame
{
    private final int width;
    private final int height;
    private final int rowStride;
    private final int pixelStride;
    private final byte[] luma;
    private final long timestampNs; // monotonic
    private final PixelFormat format;

    public RawFrame(int width, int height, int rowStride, int pixelStride, byte[] luma, long timestampNs, PixelFormat format)
    {
        if (width <= 0 || height <= 0)
        {
            throw new IllegalArgumentException("frame size must be positive " + width + "x" + height);
        }
        if (pixelStride <= 0 || rowStride < (width - 1) * pixelStride + 1)
        {
            throw new IllegalArgumentException("bad strides row " + rowStride + " pixel " + pixelStride + " for width " + width);
        }
        this.luma = Objects.requireNonNull(luma, "luma");
        this.format = Objects.requireNonNull(format, "format");
        if (luma.length < (long)(height - 1) * rowStride + (long)(width - 1) * pixelStride + 1)
        {
            throw new IllegalArgumentException("luma buffer too small " + luma.length + " for " + width + "x" + height + " row stride " + rowStride);
        }
        this.width = width;
        this.height = height;
        this.rowStride = rowStride;
        this.pixelStride = pixelStride;
        this.timestampNs = timestampNs;
    }

    /**
     * Tightly packed 8 bit gray frame
     */
    public static RawFrame gray(int width, int height, byte[] luma, long timestampNs)
    {
        return new RawFrame(width, height, width, 1, luma, timestampNs, PixelFormat.GRAY8);
    }

    public int width()
    {
        return width;
    }
    public int height()
    {
        return height;
    }
    public int rowStride()
    {
        return rowStride;
    }
    public int pixelStride()
    {
        return pixelStride;
    }
    public long timestampNs()
    {
        return timestampNs;
    }
    public PixelFormat format()
    {
        return format;
    }

    /**
     * @return luma value [0, 255] at (x, y)
     */
    public int luma(int x, int y)
    {
        return luma[y * rowStride + x * pixelStride] & 0xFF;
    }

    /**
     * Direct access for the tight loops; callers must not modify or retain it.
     */
    byte[] buffer()
    {
        return luma;
    }
}
