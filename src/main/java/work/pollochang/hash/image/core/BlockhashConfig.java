package work.pollochang.hash.image.core;

import java.util.Objects;

/**
 * 雜湊參數，建立時即驗證。
 * @param quick         一律使用整除切塊
 * @param bits          區塊格邊長 N，雜湊長度為 N*N/4 個十六進位字元
 * @param size          雜湊前縮放尺寸，{@code null} 表示不縮放
 * @param interpolation 縮放插值方法
 * @param debug         是否輸出位元圖
 */
public record BlockhashConfig(boolean quick, int bits, ImageSize size, Interpolation interpolation, boolean debug) {

    public static final int DEFAULT_BITS = 16;
    /** 區塊格上限，bits² 個區塊總和仍可放進單一陣列 */
    public static final int MAX_BITS = 4096;

    public BlockhashConfig {
        Objects.requireNonNull(interpolation, "interpolation must not be null");
        if (bits < 2 || bits > MAX_BITS) {
            throw new InvalidConfigurationException("bits 必須介於 2 與 " + MAX_BITS + " 之間，收到: " + bits);
        }
        // 位元數需為 4 的倍數才能完整編成十六進位
        if ((bits * bits) % 4 != 0) {
            throw new InvalidConfigurationException("bits 的平方必須可被 4 整除，收到: " + bits);
        }
    }

    public static BlockhashConfig defaults() {
        return new BlockhashConfig(false, DEFAULT_BITS, null, Interpolation.NEAREST, false);
    }

    public BlockhashConfig withBits(int bits) {
        return new BlockhashConfig(quick, bits, size, interpolation, debug);
    }

    public BlockhashConfig withQuick(boolean quick) {
        return new BlockhashConfig(quick, bits, size, interpolation, debug);
    }

    public BlockhashConfig withSize(ImageSize size, Interpolation interpolation) {
        return new BlockhashConfig(quick, bits, size, interpolation, debug);
    }

    public BlockhashConfig withDebug(boolean debug) {
        return new BlockhashConfig(quick, bits, size, interpolation, debug);
    }

    /**
     * 雜湊長度 (十六進位字元數)。
     */
    public int hashLength() {
        return bits * bits / 4;
    }

    /**
     * 影響雜湊結果的參數摘要，作為快取鍵的一部分。
     */
    public String fingerprint() {
        return "bits=" + bits + ";quick=" + quick
                + ";size=" + (size == null ? "none" : size) + ";interpolation=" + interpolation.getCode();
    }
}
