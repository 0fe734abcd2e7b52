package work.pollochang.hash.image.core;

/**
 * 將單一像素轉為亮度值 (三個通道相加，範圍 0~765)。
 */
public final class PixelSampler {

    /** 完全透明像素視為純白。 */
    public static final int TRANSPARENT_VALUE = 255 * 3;

    private PixelSampler() {}

    /**
     * 取得像素亮度。
     *
     * @param grid 已正規化為 RGB 或 RGBA 的像素格
     * @param x    欄位
     * @param y    列
     * @return r + g + b；RGBA 且 alpha 為 0 時回傳 {@value #TRANSPARENT_VALUE}
     * @throws UnsupportedModeException 模式不是 RGB/RGBA
     */
    public static int sample(PixelGrid grid, int x, int y) {
        requireSupported(grid);
        int[] p = grid.rgba(x, y);
        if (grid.mode() == ChannelMode.RGBA && p[3] == 0) {
            return TRANSPARENT_VALUE;
        }
        return p[0] + p[1] + p[2];
    }

    /**
     * 在進入逐像素迴圈前先確認模式。
     */
    static void requireSupported(PixelGrid grid) {
        ChannelMode mode = grid.mode();
        if (mode != ChannelMode.RGB && mode != ChannelMode.RGBA) {
            throw new UnsupportedModeException(mode);
        }
    }
}
