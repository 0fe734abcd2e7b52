package work.pollochang.hash.image.core;

/**
 * 已解碼的唯讀像素格。
 * <p>
 * 核心演算法只透過此介面讀取像素，不會修改或保留呼叫端的影像。
 */
public interface PixelGrid {

    int width();

    int height();

    ChannelMode mode();

    /**
     * 讀取單一像素。
     *
     * @param x 0 &le; x &lt; {@link #width()}
     * @param y 0 &le; y &lt; {@link #height()}
     * @return 依序為 r, g, b, a 的四個 0~255 數值；無透明通道的模式 a 固定為 255
     */
    int[] rgba(int x, int y);
}
