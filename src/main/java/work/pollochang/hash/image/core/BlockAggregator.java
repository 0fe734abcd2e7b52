package work.pollochang.hash.image.core;

/**
 * 將像素格切成 bits x bits 區塊並累加每個區塊的亮度。
 */
public interface BlockAggregator {

    /**
     * @param grid RGB 或 RGBA 像素格
     * @param bits 區塊格邊長
     * @return 列優先排列的區塊累加值
     * @throws UnsupportedModeException 模式不是 RGB/RGBA
     */
    BlockGrid aggregate(PixelGrid grid, int bits);
}
