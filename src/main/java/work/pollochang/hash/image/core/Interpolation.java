package work.pollochang.hash.image.core;

/**
 * 雜湊前縮放圖片使用的插值方法，代碼與命令列參數一致。
 */
public enum Interpolation {
    NEAREST(1, "最近鄰"),
    BILINEAR(2, "雙線性"),
    BICUBIC(3, "雙三次"),
    ANTIALIAS(4, "抗鋸齒");

    private final int code;
    private final String description;

    Interpolation(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() { return code; }

    public String getDescription() { return description; }

    /**
     * @throws InvalidConfigurationException 代碼不在 1~4 之間
     */
    public static Interpolation fromCode(int code) {
        for (Interpolation interpolation : values()) {
            if (interpolation.code == code) {
                return interpolation;
            }
        }
        throw new InvalidConfigurationException("interpolation 必須是 1 到 4 之間的整數，收到: " + code);
    }
}
