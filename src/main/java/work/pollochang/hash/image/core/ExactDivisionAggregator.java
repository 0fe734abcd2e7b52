package work.pollochang.hash.image.core;

/**
 * 整除切塊：區塊尺寸為 (W / bits, H / bits) 的整數截斷值，逐區塊加總像素亮度。
 * <p>
 * 尺寸無法整除時 (quick 模式)，右側與下方多出的像素不列入計算。
 */
final class ExactDivisionAggregator implements BlockAggregator {

    @Override
    public BlockGrid aggregate(PixelGrid grid, int bits) {
        PixelSampler.requireSupported(grid);

        int blockWidth = grid.width() / bits;
        int blockHeight = grid.height() / bits;
        double[] sums = new double[bits * bits];

        for (int by = 0; by < bits; by++) {
            for (int bx = 0; bx < bits; bx++) {
                long value = 0;
                for (int iy = 0; iy < blockHeight; iy++) {
                    for (int ix = 0; ix < blockWidth; ix++) {
                        value += PixelSampler.sample(grid, bx * blockWidth + ix, by * blockHeight + iy);
                    }
                }
                sums[by * bits + bx] = value;
            }
        }

        return new BlockGrid(bits, sums, (double) blockWidth * blockHeight);
    }
}
