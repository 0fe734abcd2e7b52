package work.pollochang.hash.image.core;

/**
 * 區塊亮度累加結果。
 * @param bits           區塊格邊長 N
 * @param sums           N*N 個累加值，列優先排列
 * @param pixelsPerBlock 每個區塊涵蓋的像素數 (加權分配時為小數)
 */
public record BlockGrid(int bits, double[] sums, double pixelsPerBlock) {

    public BlockGrid {
        if (sums.length != bits * bits) {
            throw new IllegalArgumentException("區塊數量 " + sums.length + " 不等於 " + bits + "x" + bits);
        }
    }

    public double get(int row, int col) {
        return sums[row * bits + col];
    }
}
