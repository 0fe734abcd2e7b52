package work.pollochang.hash.image.core;

/**
 * 像素格通道模式不是 RGB 或 RGBA 時，取樣器無法計算亮度。
 */
public class UnsupportedModeException extends RuntimeException {

    private final ChannelMode mode;

    public UnsupportedModeException(ChannelMode mode) {
        super("不支援的影像模式: " + mode);
        this.mode = mode;
    }

    public ChannelMode getMode() { return mode; }
}
