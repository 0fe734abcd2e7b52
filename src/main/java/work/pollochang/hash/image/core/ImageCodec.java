package work.pollochang.hash.image.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 影像解碼與轉換的外部協作者。轉換與縮放都回傳新的像素格，不修改傳入的影像。
 */
public interface ImageCodec {

    /**
     * 解碼圖片檔。
     * @throws IOException 檔案無法讀取或格式不支援
     */
    PixelGrid decode(Path path) throws IOException;

    PixelGrid convert(PixelGrid grid, ChannelMode target);

    PixelGrid resize(PixelGrid grid, ImageSize size, Interpolation interpolation);
}
