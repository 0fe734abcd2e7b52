package work.pollochang.hash.image.core;

/**
 * 雜湊參數不合法，於建立設定時即拋出，不會處理任何圖片。
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
