package work.pollochang.hash.image.core;

/**
 * 像素格的通道配置。只有 {@link #RGB} 與 {@link #RGBA} 能直接進行取樣，
 * 其餘模式需先由 {@link ImageCodec#convert} 轉換。
 */
public enum ChannelMode {
    BILEVEL("黑白二值", false),
    GRAY("灰階", false),
    GRAY_ALPHA("灰階含透明", true),
    INDEXED("索引色", false),
    RGB("RGB", false),
    RGBA("RGBA", true);

    private final String description;
    private final boolean alpha;

    ChannelMode(String description, boolean alpha) {
        this.description = description;
        this.alpha = alpha;
    }

    public String getDescription() { return description; }

    public boolean hasAlpha() { return alpha; }

    /**
     * 取樣前需要轉換成的目標模式；已是 RGB/RGBA 則回傳自己。
     */
    public ChannelMode normalized() {
        return switch (this) {
            case BILEVEL, GRAY, INDEXED -> RGB;
            case GRAY_ALPHA -> RGBA;
            default -> this;
        };
    }
}
