package work.pollochang.hash.image.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 雜湊前的縮放目標尺寸。
 * @param width  寬 (px)
 * @param height 高 (px)
 */
public record ImageSize(int width, int height) {

    private static final Pattern SIZE_PATTERN = Pattern.compile("(\\d+)\\s*[xX]\\s*(\\d+)");

    public ImageSize {
        if (width <= 0 || height <= 0) {
            throw new InvalidConfigurationException("縮放尺寸必須為正數: " + width + "x" + height);
        }
    }

    /**
     * 解析 {@code 256x256} 格式的字串。
     */
    public static ImageSize parse(String text) {
        Matcher matcher = SIZE_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidConfigurationException("無法解析縮放尺寸 (格式應為 WxH): " + text);
        }
        try {
            return new ImageSize(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("縮放尺寸數值過大: " + text);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
