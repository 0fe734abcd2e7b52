package work.pollochang.hash.image.tools;

import java.io.IOException;

/**
 * 找不到可解碼該檔案的 ImageIO 讀取器。
 */
public class UnsupportedFormatException extends IOException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
