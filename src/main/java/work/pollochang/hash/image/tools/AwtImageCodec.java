package work.pollochang.hash.image.tools;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.hash.image.core.ChannelMode;
import work.pollochang.hash.image.core.ImageCodec;
import work.pollochang.hash.image.core.ImageSize;
import work.pollochang.hash.image.core.Interpolation;
import work.pollochang.hash.image.core.PixelGrid;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 以 ImageIO 解碼、Java2D 轉換與縮放的 {@link ImageCodec} 實作。
 */
@Slf4j
public class AwtImageCodec implements ImageCodec {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    @Override
    public PixelGrid decode(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(is)) {
            if (in == null) {
                throw new UnsupportedFormatException("無法建立圖片輸入流: " + path);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new UnsupportedFormatException("找不到對應的圖片讀取器: " + path);
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage image = reader.read(0, reader.getDefaultReadParam());
                BufferedImagePixelGrid grid = BufferedImagePixelGrid.of(image);
                log.debug("{} - 解碼完成 ({}, {}x{}, {})", path, reader.getFormatName(), grid.width(), grid.height(), grid.mode());
                return grid;
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * 轉換為 RGB 或 RGBA。轉為 RGB 時捨棄透明通道。
     */
    @Override
    public PixelGrid convert(PixelGrid grid, ChannelMode target) {
        if (target != ChannelMode.RGB && target != ChannelMode.RGBA) {
            throw new IllegalArgumentException("只能轉換為 RGB 或 RGBA: " + target);
        }
        boolean alpha = target == ChannelMode.RGBA;
        BufferedImage converted = new BufferedImage(grid.width(), grid.height(),
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                int[] p = grid.rgba(x, y);
                int a = alpha ? p[3] : 0xff;
                converted.setRGB(x, y, a << 24 | p[0] << 16 | p[1] << 8 | p[2]);
            }
        }
        return new BufferedImagePixelGrid(converted, target);
    }

    /**
     * 縮放至指定尺寸，保留透明通道。ANTIALIAS 使用區域平均縮放。
     */
    @Override
    public PixelGrid resize(PixelGrid grid, ImageSize size, Interpolation interpolation) {
        BufferedImage source = toBufferedImage(grid);
        boolean alpha = grid.mode().hasAlpha();
        int newWidth = size.width();
        int newHeight = size.height();

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = resizedImage.createGraphics();
        try {
            g2d.setComposite(AlphaComposite.Src);
            if (interpolation == Interpolation.ANTIALIAS) {
                Image scaled = source.getScaledInstance(newWidth, newHeight, Image.SCALE_AREA_AVERAGING);
                g2d.drawImage(scaled, 0, 0, null);
            } else {
                g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, renderingHint(interpolation));
                g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g2d.drawImage(source, 0, 0, newWidth, newHeight, null);
            }
        } finally {
            g2d.dispose();
        }
        log.trace("縮放 {}x{} -> {} ({})", grid.width(), grid.height(), size, interpolation.getDescription());
        return new BufferedImagePixelGrid(resizedImage, grid.mode());
    }

    private static Object renderingHint(Interpolation interpolation) {
        return switch (interpolation) {
            case BILINEAR -> RenderingHints.VALUE_INTERPOLATION_BILINEAR;
            case BICUBIC -> RenderingHints.VALUE_INTERPOLATION_BICUBIC;
            default -> RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR;
        };
    }

    private BufferedImage toBufferedImage(PixelGrid grid) {
        if (grid instanceof BufferedImagePixelGrid bufferedGrid) {
            return bufferedGrid.getImage();
        }
        ChannelMode target = grid.mode().hasAlpha() ? ChannelMode.RGBA : ChannelMode.RGB;
        return ((BufferedImagePixelGrid) convert(grid, target)).getImage();
    }
}
