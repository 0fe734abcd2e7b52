package work.pollochang.hash.image.tools;

import work.pollochang.hash.image.core.ChannelMode;
import work.pollochang.hash.image.core.PixelGrid;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Objects;

/**
 * 以 {@link BufferedImage} 為底的像素格。
 *
 * <p>彩色與索引色影像透過 {@link BufferedImage#getRGB(int, int)} 取得 sRGB 值；
 * 灰階影像直接讀取 raster 樣本並複製到 r、g、b，不經過色彩空間轉換。
 */
public final class BufferedImagePixelGrid implements PixelGrid {

    private final BufferedImage image;
    private final ChannelMode mode;

    public BufferedImagePixelGrid(BufferedImage image, ChannelMode mode) {
        this.image = Objects.requireNonNull(image, "image must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /**
     * 依影像的色彩模型推斷通道模式。
     */
    public static BufferedImagePixelGrid of(BufferedImage image) {
        return new BufferedImagePixelGrid(image, detectMode(image));
    }

    static ChannelMode detectMode(BufferedImage image) {
        ColorModel cm = image.getColorModel();
        if (cm instanceof IndexColorModel icm) {
            if (icm.getMapSize() <= 2 && icm.getPixelSize() == 1) {
                return ChannelMode.BILEVEL;
            }
            return ChannelMode.INDEXED;
        }
        boolean gray = cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
        if (gray) {
            return cm.hasAlpha() ? ChannelMode.GRAY_ALPHA : ChannelMode.GRAY;
        }
        return cm.hasAlpha() ? ChannelMode.RGBA : ChannelMode.RGB;
    }

    public BufferedImage getImage() { return image; }

    @Override
    public int width() { return image.getWidth(); }

    @Override
    public int height() { return image.getHeight(); }

    @Override
    public ChannelMode mode() { return mode; }

    @Override
    public int[] rgba(int x, int y) {
        if (mode == ChannelMode.GRAY || mode == ChannelMode.GRAY_ALPHA) {
            return grayRgba(x, y);
        }
        int p = image.getRGB(x, y);
        int a = mode.hasAlpha() ? (p >>> 24) : 0xff;
        return new int[]{(p >> 16) & 0xff, (p >> 8) & 0xff, p & 0xff, a};
    }

    /**
     * 灰階樣本原值複製到三個通道 (getRGB 會套用 sRGB 轉換，128 → 188)。16 位元樣本取高 8 位元。
     */
    private int[] grayRgba(int x, int y) {
        Raster raster = image.getRaster();
        int gray = toEightBits(raster.getSample(x, y, 0), raster.getSampleModel().getSampleSize(0));
        int a = 0xff;
        if (mode == ChannelMode.GRAY_ALPHA && raster.getNumBands() > 1) {
            a = toEightBits(raster.getSample(x, y, 1), raster.getSampleModel().getSampleSize(1));
        }
        return new int[]{gray, gray, gray, a};
    }

    private static int toEightBits(int sample, int sampleSize) {
        return sampleSize > 8 ? sample >>> (sampleSize - 8) : sample;
    }
}
