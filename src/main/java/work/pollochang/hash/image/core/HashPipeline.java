package work.pollochang.hash.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * 區塊平均值感知雜湊 (blockhash) 的處理流程。
 *
 * <p>每張圖片依序經過：
 * <ol>
 *   <li>通道模式正規化 (灰階、索引色 → RGB，灰階含透明 → RGBA)。</li>
 *   <li>依設定縮放至固定尺寸 (選用)。</li>
 *   <li>依 quick 設定與尺寸是否整除選擇 {@link AggregationStrategy}，累加區塊亮度。</li>
 *   <li>{@link MedianThresholder} 轉位元，{@link HexEncoder} 編成十六進位字串。</li>
 * </ol>
 *
 * <p>轉換與縮放交給 {@link ImageCodec}，核心不會修改傳入的像素格。
 * 每張圖片的計算彼此獨立，同一個實例可在多執行緒下共用 (除位元圖觀察者外)。
 *
 * <p>使用範例：
 * <pre>{@code
 * HashPipeline pipeline = new HashPipeline(BlockhashConfig.defaults(), new AwtImageCodec());
 * String hash = pipeline.hash(codec.decode(Paths.get("cat.jpg")));
 * }</pre>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class HashPipeline {

    private final BlockhashConfig config;
    private final ImageCodec codec;
    private final Consumer<String> debugObserver;

    public HashPipeline(BlockhashConfig config) {
        this(config, null, null);
    }

    public HashPipeline(BlockhashConfig config, ImageCodec codec) {
        this(config, codec, null);
    }

    /**
     * @param config        雜湊參數
     * @param codec         模式轉換與縮放協作者，可為 {@code null} (此時輸入必須已是 RGB/RGBA 且不縮放)
     * @param debugObserver 接收位元圖文字；為 {@code null} 且啟用 debug 時改寫入日誌
     * @throws InvalidConfigurationException 設定了縮放尺寸卻沒有提供 codec
     */
    public HashPipeline(BlockhashConfig config, ImageCodec codec, Consumer<String> debugObserver) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.size() != null && codec == null) {
            throw new InvalidConfigurationException("設定縮放尺寸 " + config.size() + " 時必須提供 ImageCodec");
        }
        this.codec = codec;
        this.debugObserver = debugObserver != null ? debugObserver : grid -> log.info("位元圖:\n{}", grid);
    }

    public BlockhashConfig getConfig() { return config; }

    /**
     * 計算單張圖片的雜湊。
     *
     * @param grid 已解碼的像素格
     * @return 長度為 {@code bits * bits / 4} 的小寫十六進位字串
     * @throws UnsupportedModeException 模式無法正規化為 RGB/RGBA
     */
    public String hash(PixelGrid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        PixelGrid prepared = prepare(grid);

        AggregationStrategy strategy = strategyFor(prepared);
        log.trace("{}x{} ({}) 使用 {} 演算法", prepared.width(), prepared.height(), prepared.mode(), strategy.getDescription());

        BlockGrid blocks = strategy.aggregate(prepared, config.bits());
        String hash = HexEncoder.encode(MedianThresholder.threshold(blocks));

        if (config.debug()) {
            debugObserver.accept(HexEncoder.toBitGrid(hash, config.bits()));
        }
        return hash;
    }

    /**
     * 逐張拉取圖片並產生雜湊，只在呼叫 {@code next()} 時才計算，不預先讀取整批圖片。
     */
    public Iterator<String> hashes(Iterator<? extends PixelGrid> images) {
        Objects.requireNonNull(images, "images must not be null");
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return images.hasNext();
            }

            @Override
            public String next() {
                if (!images.hasNext()) {
                    throw new NoSuchElementException();
                }
                return hash(images.next());
            }
        };
    }

    /**
     * 串流版本，保留輸入順序；呼叫端可自行改為平行串流。
     */
    public Stream<String> hashes(Stream<? extends PixelGrid> images) {
        return images.map(this::hash);
    }

    /**
     * 依設定與 (縮放後) 尺寸選擇區塊累加演算法。
     */
    public AggregationStrategy strategyFor(PixelGrid grid) {
        return AggregationStrategy.select(grid.width(), grid.height(), config.bits(), config.quick());
    }

    private PixelGrid prepare(PixelGrid grid) {
        PixelGrid current = grid;
        ChannelMode target = current.mode().normalized();
        if (target != current.mode() && codec != null) {
            log.debug("將 {} 模式轉換為 {}", current.mode().getDescription(), target.getDescription());
            current = codec.convert(current, target);
        }
        if (config.size() != null) {
            current = codec.resize(current, config.size(), config.interpolation());
        }
        return current;
    }
}
