package work.pollochang.hash.image.core;

/**
 * 位元序列與十六進位雜湊字串之間的轉換 (最高位元在前，小寫)。
 */
public final class HexEncoder {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexEncoder() {}

    /**
     * @param bits 長度需為 4 的倍數
     * @return 長度為 {@code bits.length / 4} 的小寫十六進位字串，左側補零
     */
    public static String encode(boolean[] bits) {
        if (bits.length % 4 != 0) {
            throw new IllegalArgumentException("位元數 " + bits.length + " 不是 4 的倍數");
        }
        StringBuilder sb = new StringBuilder(bits.length / 4);
        for (int i = 0; i < bits.length; i += 4) {
            int nibble = (bits[i] ? 8 : 0) | (bits[i + 1] ? 4 : 0) | (bits[i + 2] ? 2 : 0) | (bits[i + 3] ? 1 : 0);
            sb.append(DIGITS[nibble]);
        }
        return sb.toString();
    }

    public static boolean[] decode(String hash) {
        boolean[] bits = new boolean[hash.length() * 4];
        for (int i = 0; i < hash.length(); i++) {
            int nibble = Character.digit(hash.charAt(i), 16);
            if (nibble < 0) {
                throw new IllegalArgumentException("非十六進位字元: " + hash.charAt(i));
            }
            for (int b = 0; b < 4; b++) {
                bits[i * 4 + b] = (nibble & (8 >> b)) != 0;
            }
        }
        return bits;
    }

    /**
     * 將雜湊排成 bits 列、每列 bits 個 0/1 字元的文字圖，列間以換行分隔。
     */
    public static String toBitGrid(String hash, int bits) {
        boolean[] decoded = decode(hash);
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row * bits < decoded.length; row++) {
            if (row > 0) {
                sb.append('\n');
            }
            for (int col = 0; col < bits; col++) {
                sb.append(decoded[row * bits + col] ? '1' : '0');
            }
        }
        return sb.toString();
    }
}
