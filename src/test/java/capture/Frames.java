package capture;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic gray frames for tests
 */
final class Frames {

    private Frames() {}

    static byte[] uniform(int width, int height, int value) {
        byte[] luma = new byte[width * height];
        Arrays.fill(luma, (byte) value);
        return luma;
    }

    /**
     * Texture with values in [20, 235]; sharp and never clipped
     */
    static byte[] noise(int width, int height, long seed) {
        Random random = new Random(seed);
        byte[] luma = new byte[width * height];
        for (int i = 0; i < luma.length; i++) {
            luma[i] = (byte) (20 + random.nextInt(216));
        }
        return luma;
    }

    static void fillRect(byte[] luma, int width, int x0, int y0, int w, int h, int value) {
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) {
                luma[y * width + x] = (byte) value;
            }
        }
    }

    static RawFrame gray(int width, int height, byte[] luma, long timestampNs) {
        return RawFrame.gray(width, height, luma, timestampNs);
    }
}
