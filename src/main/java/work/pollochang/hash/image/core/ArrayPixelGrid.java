package work.pollochang.hash.image.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 以 packed ARGB 整數陣列保存的像素格，列優先 (row-major) 排列。
 */
public final class ArrayPixelGrid implements PixelGrid {

    private final int width;
    private final int height;
    private final ChannelMode mode;
    private final int[] argb;

    public ArrayPixelGrid(int width, int height, ChannelMode mode, int[] argb) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(argb, "argb must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("像素格尺寸必須為正數: " + width + "x" + height);
        }
        if (argb.length != width * height) {
            throw new IllegalArgumentException("像素數量 " + argb.length + " 與尺寸 " + width + "x" + height + " 不符");
        }
        this.width = width;
        this.height = height;
        this.mode = mode;
        this.argb = argb.clone();
    }

    /**
     * 建立單一顏色的像素格。
     */
    public static ArrayPixelGrid filled(int width, int height, ChannelMode mode, int argb) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argb);
        return new ArrayPixelGrid(width, height, mode, pixels);
    }

    public static int argb(int a, int r, int g, int b) {
        return (a & 0xff) << 24 | (r & 0xff) << 16 | (g & 0xff) << 8 | (b & 0xff);
    }

    @Override
    public int width() { return width; }

    @Override
    public int height() { return height; }

    @Override
    public ChannelMode mode() { return mode; }

    @Override
    public int[] rgba(int x, int y) {
        int p = argb[y * width + x];
        int a = mode.hasAlpha() ? (p >>> 24) : 0xff;
        return new int[]{(p >> 16) & 0xff, (p >> 8) & 0xff, p & 0xff, a};
    }
}
