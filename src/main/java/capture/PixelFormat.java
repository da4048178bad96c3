package capture;

/**
 * Layout of the buffer handed over by the frame source.
 * 
 * Only the luma compatible formats carry a single channel plane the analyzers can read directly.
 */
public enum PixelFormat
{
    GRAY8(true),
    YUV_420_888(true), // plane 0 is luma
    RGBA_8888(false),
    JPEG(false);

    private final boolean lumaCompatible;

    PixelFormat(boolean lumaCompatible)
    {
        this.lumaCompatible = lumaCompatible;
    }

    public boolean isLumaCompatible()
    {
        return lumaCompatible;
    }
}
