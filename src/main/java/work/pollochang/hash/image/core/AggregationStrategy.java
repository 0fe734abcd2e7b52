package work.pollochang.hash.image.core;

/**
 * 區塊累加演算法。
 */
public enum AggregationStrategy implements BlockAggregator {
    EXACT_DIVISION("整除切塊", new ExactDivisionAggregator()),
    WEIGHTED_DISTRIBUTION("子像素加權分配", new WeightedDistributionAggregator());

    private final String description;
    private final BlockAggregator aggregator;

    AggregationStrategy(String description, BlockAggregator aggregator) {
        this.description = description;
        this.aggregator = aggregator;
    }

    public String getDescription() { return description; }

    @Override
    public BlockGrid aggregate(PixelGrid grid, int bits) {
        return aggregator.aggregate(grid, bits);
    }

    /**
     * 依設定與尺寸選擇演算法：quick 模式一律整除切塊，
     * 否則只有寬高皆可被 bits 整除時才使用整除切塊。
     */
    public static AggregationStrategy select(int width, int height, int bits, boolean quick) {
        if (quick || (width % bits == 0 && height % bits == 0)) {
            return EXACT_DIVISION;
        }
        return WEIGHTED_DISTRIBUTION;
    }
}
