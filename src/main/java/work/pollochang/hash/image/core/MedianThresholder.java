package work.pollochang.hash.image.core;

import java.util.Arrays;

/**
 * 將區塊累加值依四條水平帶各自的中位數轉為位元。
 */
public final class MedianThresholder {

    /** 半個區塊亮度的單像素基準值 (256 * 3 / 2)，沿用原演算法的數值，不是 765 / 2。 */
    public static final int HALF_PIXEL_VALUE = 256 * 3 / 2;

    public static final int BANDS = 4;

    private MedianThresholder() {}

    /**
     * 將列優先排列的累加值切成 4 條連續等長的帶，逐帶與中位數比較。
     * <p>
     * 大於中位數輸出 1。以黑或白為主的圖片常有大量區塊恰好等於中位數，
     * 此時若中位數落在亮度上半區 (大於 {@code pixelsPerBlock * 384}) 則輸出 1，否則輸出 0。
     *
     * @param sums           區塊累加值，長度需為 4 的倍數
     * @param pixelsPerBlock 每個區塊的像素數
     * @return 與 {@code sums} 等長、順序相同的位元
     */
    public static boolean[] threshold(double[] sums, double pixelsPerBlock) {
        if (sums.length % BANDS != 0) {
            throw new IllegalArgumentException("區塊數量 " + sums.length + " 無法平均分成 " + BANDS + " 條");
        }

        double halfBlockValue = pixelsPerBlock * HALF_PIXEL_VALUE;
        int bandSize = sums.length / BANDS;
        boolean[] bits = new boolean[sums.length];

        for (int band = 0; band < BANDS; band++) {
            int from = band * bandSize;
            int to = from + bandSize;
            double m = median(Arrays.copyOfRange(sums, from, to));

            for (int i = from; i < to; i++) {
                double v = sums[i];
                bits[i] = v > m || (Math.abs(v - m) < 1 && m > halfBlockValue);
            }
        }
        return bits;
    }

    public static boolean[] threshold(BlockGrid blocks) {
        return threshold(blocks.sums(), blocks.pixelsPerBlock());
    }

    /**
     * 偶數長度時取中間兩值的平均。會排序傳入的陣列。
     */
    static double median(double[] values) {
        Arrays.sort(values);
        int length = values.length;
        if (length % 2 == 0) {
            return (values[length / 2 - 1] + values[length / 2]) / 2.0;
        }
        return values[length / 2];
    }
}
