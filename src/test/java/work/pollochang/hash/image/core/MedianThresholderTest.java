package work.pollochang.hash.image.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MedianThresholderTest {

    /**
     * 全部等於中位數且中位數高於半區塊值 → 全為 1
     */
    @Test
    void testBandEqualToBrightMedian_ShouldBeAllOnes() {
        double pixelsPerBlock = 4;
        double[] sums = new double[16];
        Arrays.fill(sums, 1537); // 半區塊值 = 4 * 384 = 1536

        boolean[] bits = MedianThresholder.threshold(sums, pixelsPerBlock);

        for (boolean bit : bits) {
            assertTrue(bit);
        }
    }

    /**
     * 全部等於中位數且中位數不高於半區塊值 → 全為 0
     */
    @Test
    void testBandEqualToDarkMedian_ShouldBeAllZeros() {
        double[] sums = new double[16];
        Arrays.fill(sums, 1536);

        boolean[] bits = MedianThresholder.threshold(sums, 4);

        for (boolean bit : bits) {
            assertFalse(bit);
        }
    }

    /**
     * 半區塊值使用 384 而非 765 / 2 = 382.5
     */
    @Test
    void testHalfBlockValue_ShouldUse384() {
        double[] sums = {383, 383, 383, 383};
        boolean[] bits = MedianThresholder.threshold(sums, 1);
        assertArrayEquals(new boolean[]{false, false, false, false}, bits);
    }

    /**
     * 每條帶各自計算中位數，不受其他帶影響
     */
    @Test
    void testBands_ShouldBeThresholdedIndependently() {
        double[] sums = {
                1, 2, 3, 4,
                100, 200, 300, 400,
                0, 0, 0, 9,
                5, 5, 5, 5
        };

        boolean[] bits = MedianThresholder.threshold(sums, 1);

        assertArrayEquals(new boolean[]{
                false, false, true, true,
                false, false, true, true,
                false, false, false, true,
                false, false, false, false
        }, bits);
    }

    /**
     * 與中位數差距小於 1 的值也套用亮區規則
     */
    @Test
    void testNearMedianInBrightBand_ShouldBeOne() {
        double[] sums = {500, 500.5, 499.6, 10};
        boolean[] bits = MedianThresholder.threshold(new double[]{
                500, 500.5, 499.6, 10,
                0, 0, 0, 0,
                0, 0, 0, 0,
                0, 0, 0, 0
        }, 1);

        // 第一條帶中位數為 (499.6 + 500) / 2 = 499.8
        assertEquals(499.8, MedianThresholder.median(sums.clone()), 1e-9);
        assertTrue(bits[0]);
        assertTrue(bits[1]);
        assertTrue(bits[2]);
        assertFalse(bits[3]);
    }

    @Test
    void testMedian_ShouldAverageCentralValuesForEvenLength() {
        assertEquals(2.5, MedianThresholder.median(new double[]{4, 1, 3, 2}));
        assertEquals(3, MedianThresholder.median(new double[]{5, 3, 1}));
    }

    @Test
    void testLengthNotDivisibleByFour_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> MedianThresholder.threshold(new double[9], 1));
    }
}
