package work.pollochang.hash.image.core;

/**
 * 子像素加權分配：區塊尺寸為小數 (W / bits, H / bits)，
 * 跨越區塊邊界的像素依重疊比例分給左右 (上下) 兩個區塊，
 * 等同於不重新取樣影像的面積加權縮圖。
 */
final class WeightedDistributionAggregator implements BlockAggregator {

    private final BlockAggregator exact = new ExactDivisionAggregator();

    @Override
    public BlockGrid aggregate(PixelGrid grid, int bits) {
        if (grid.width() % bits == 0 && grid.height() % bits == 0) {
            return exact.aggregate(grid, bits);
        }
        return distribute(grid, bits);
    }

    /**
     * 不論尺寸是否整除，一律走加權分配。
     */
    BlockGrid distribute(PixelGrid grid, int bits) {
        PixelSampler.requireSupported(grid);

        int width = grid.width();
        int height = grid.height();
        double blockWidth = (double) width / bits;
        double blockHeight = (double) height / bits;
        boolean evenX = width % bits == 0;
        boolean evenY = height % bits == 0;

        // 欄的分配方式每列都相同，先算好
        Span[] columns = new Span[width];
        for (int x = 0; x < width; x++) {
            columns[x] = evenX ? Span.whole(floorDiv(x, blockWidth)) : Span.of(x, width, blockWidth);
        }

        double[] sums = new double[bits * bits];
        for (int y = 0; y < height; y++) {
            Span row = evenY ? Span.whole(floorDiv(y, blockHeight)) : Span.of(y, height, blockHeight);

            for (int x = 0; x < width; x++) {
                int value = PixelSampler.sample(grid, x, y);
                Span col = columns[x];

                sums[row.first() * bits + col.first()] += value * row.firstWeight() * col.firstWeight();
                sums[row.first() * bits + col.second()] += value * row.firstWeight() * col.secondWeight();
                sums[row.second() * bits + col.first()] += value * row.secondWeight() * col.firstWeight();
                sums[row.second() * bits + col.second()] += value * row.secondWeight() * col.secondWeight();
            }
        }

        return new BlockGrid(bits, sums, blockWidth * blockHeight);
    }

    /**
     * 單一像素在某個方向上所屬的一或兩個區塊與各自權重。
     */
    record Span(int first, int second, double firstWeight, double secondWeight) {

        static Span whole(int block) {
            return new Span(block, block, 1, 0);
        }

        /**
         * 以像素右 (下) 緣 i + 1 在區塊內的小數位置決定權重。
         * 右緣落在區塊內部或為最後一個像素時只屬於一個區塊。
         */
        static Span of(int i, int length, double blockSize) {
            double position = (i + 1) % blockSize;
            double whole = Math.floor(position);
            double frac = position - whole;

            int first = floorDiv(i, blockSize);
            if (whole > 0 || i + 1 == length) {
                return new Span(first, first, 1 - frac, frac);
            }
            return new Span(first, -floorDiv(-i, blockSize), 1 - frac, frac);
        }
    }

    /**
     * 浮點數向下取整除法。先以 fmod 扣除餘數再相除，
     * 避免 {@code Math.floor(a / b)} 在區塊邊界上因捨入誤差落到相鄰區塊。
     */
    static int floorDiv(double a, double b) {
        double mod = a % b;
        double div = (a - mod) / b;
        if (mod != 0 && (b < 0) != (mod < 0)) {
            div -= 1.0;
        }
        if (div == 0) {
            return 0;
        }
        double floor = Math.floor(div);
        if (div - floor > 0.5) {
            floor += 1.0;
        }
        return (int) floor;
    }
}
