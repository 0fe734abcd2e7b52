package work.pollochang.hash.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.hash.image.cache.CacheKey;
import work.pollochang.hash.image.cache.CachedHash;
import work.pollochang.hash.image.cache.H2HashCache;
import work.pollochang.hash.image.core.BlockhashConfig;
import work.pollochang.hash.image.core.HashPipeline;
import work.pollochang.hash.image.core.HashResult;
import work.pollochang.hash.image.core.HexEncoder;
import work.pollochang.hash.image.core.ImageCodec;
import work.pollochang.hash.image.core.UnsupportedModeException;
import work.pollochang.hash.image.report.HashReport;
import work.pollochang.hash.image.report.HashReportWriter;
import work.pollochang.hash.image.tools.AwtImageCodec;
import work.pollochang.hash.image.tools.UnsupportedFormatException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 進行批次雜湊計算，依輸入順序輸出 {@code "{hash}  {filename}"}。
 */
@Setter
@Slf4j
public class HashBatch {

    private List<String> filenames = Collections.emptyList();
    private Path fileListPath;
    private BlockhashConfig config = BlockhashConfig.defaults();
    private int threads = 1;
    private Path cachePath;
    private Path reportPath;
    private ImageCodec codec = new AwtImageCodec();
    private PrintStream out = System.out;

    /**
     * @return 全部成功時為 0，任一檔案失敗或略過時為 1
     */
    public int execute() {
        // 讀取快取 (若有指定)，批次期間只在記憶體中更新
        final Map<CacheKey, CachedHash> cache;
        if (cachePath != null) {
            try (H2HashCache h2 = new H2HashCache(cachePath)) {
                h2.initSchema();
                cache = h2.loadAllToMap();
            }
        } else {
            log.info("未指定快取資料庫，將使用空的記憶體快取。");
            cache = new ConcurrentHashMap<>();
        }

        // 位元圖由 printReport 與雜湊行一起輸出，工作執行緒不直接寫 out
        HashPipeline pipeline = new HashPipeline(config.withDebug(false), codec);

        Map<HashResult, AtomicLong> counters = new EnumMap<>(HashResult.class);
        for (HashResult result : HashResult.values()) {
            counters.put(result, new AtomicLong(0));
        }
        AtomicLong totalSize = new AtomicLong(0);
        List<HashReport> reports = new ArrayList<>();

        try (Stream<String> inputs = inputs()) {
            if (threads > 1) {
                runParallel(inputs, pipeline, cache, reports);
            } else {
                inputs.forEach(input -> reports.add(printReport(hashFile(input, pipeline, cache))));
            }
        } catch (IOException e) {
            log.error("讀取檔案列表失敗: {}", fileListPath, e);
            return 1;
        }

        for (HashReport report : reports) {
            counters.get(report.result()).incrementAndGet();
            totalSize.addAndGet(report.size());
        }

        if (cachePath != null) {
            try (H2HashCache h2 = new H2HashCache(cachePath)) {
                h2.saveAllFromMap(cache);
            }
        }

        if (reportPath != null) {
            try {
                new HashReportWriter().write(reportPath, reports);
            } catch (IOException e) {
                log.error("寫入報告 {} 時發生錯誤。", reportPath, e);
            }
        }

        long hashedCount = counters.get(HashResult.HASHED).get();
        long cachedCount = counters.get(HashResult.CACHED).get();
        long skippedCount = counters.get(HashResult.SKIPPED_NOT_FOUND).get();
        long failedCount = reports.size() - hashedCount - cachedCount - skippedCount;

        log.info("處理結果 -> 總計: {}, 計算: {}, 使用快取: {}, 跳過: {}, 失敗: {}, 檔案總大小: {}",
                reports.size(),
                hashedCount,
                cachedCount,
                skippedCount,
                failedCount,
                formatFileSize(totalSize.get()));

        return (skippedCount + failedCount) == 0 ? 0 : 1;
    }

    /**
     * 計算單一檔案的雜湊，所有例外都轉為 {@link HashResult}，不影響其他檔案。
     */
    HashReport hashFile(String input, HashPipeline pipeline, Map<CacheKey, CachedHash> cache) {
        Path path = Paths.get(input);
        int bits = config.bits();

        long lastModified;
        long size;
        try {
            if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
                log.warn("{} - 檔案不存在或不可讀，跳過", input);
                return HashReport.failed(input, HashResult.SKIPPED_NOT_FOUND, bits, 0);
            }
            lastModified = Files.getLastModifiedTime(path).toMillis();
            size = Files.size(path);
        } catch (IOException e) {
            log.warn("{} - 無法讀取檔案資訊", input, e);
            return HashReport.failed(input, HashResult.FAILED_IO_ERROR, bits, 0);
        }

        CacheKey key = new CacheKey(path.toAbsolutePath().normalize().toString(), config.fingerprint());
        CachedHash cached = cache.get(key);
        if (cached != null && cached.matches(lastModified, size)) {
            log.debug("{} - 命中快取", input);
            return new HashReport(input, HashResult.CACHED, cached.hash(), bits, size);
        }

        try {
            String hash = pipeline.hash(codec.decode(path));
            cache.put(key, new CachedHash(lastModified, size, hash));
            log.debug("{} - 雜湊完成: {}", input, hash);
            return new HashReport(input, HashResult.HASHED, hash, bits, size);
        } catch (UnsupportedFormatException e) {
            log.warn("{} - 格式不支援: {}", input, e.getMessage());
            return HashReport.failed(input, HashResult.FAILED_UNSUPPORTED_FORMAT, bits, size);
        } catch (IOException e) {
            log.warn("{} - 讀取圖片時發生 I/O 錯誤 (可能檔案損毀)", input, e);
            return HashReport.failed(input, HashResult.FAILED_IO_ERROR, bits, size);
        } catch (UnsupportedModeException e) {
            log.warn("{} - {}", input, e.getMessage());
            return HashReport.failed(input, HashResult.FAILED_UNSUPPORTED_MODE, bits, size);
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大)", input, e);
            return HashReport.failed(input, HashResult.FAILED_OUT_OF_MEMORY, bits, size);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", input, e);
            return HashReport.failed(input, HashResult.FAILED_UNKNOWN, bits, size);
        }
    }

    /**
     * 以固定大小的執行緒池計算，仍依輸入順序輸出。
     */
    private void runParallel(Stream<String> inputs, HashPipeline pipeline, Map<CacheKey, CachedHash> cache,
                             List<HashReport> reports) {
        log.info("建立固定大小為 {} 的執行緒池。", threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<HashReport>> futures = new ArrayList<>();
            inputs.forEach(input -> futures.add(executor.submit(() -> hashFile(input, pipeline, cache))));
            log.info("已提交 {} 個任務，等待處理完成...", futures.size());

            for (Future<HashReport> future : futures) {
                reports.add(printReport(future.get()));
            }
        } catch (InterruptedException e) {
            log.error("執行緒池被中斷。", e);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // hashFile 已攔截所有 Exception，這裡只會是 Error
            throw new IllegalStateException("雜湊任務異常終止", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private Stream<String> inputs() throws IOException {
        Stream<String> fromArgs = filenames.stream();
        if (fileListPath == null) {
            return fromArgs;
        }
        // 使用 Stream API 逐行讀取檔案，避免一次性將整個列表載入記憶體
        Stream<String> fromList = Files.lines(fileListPath)
                .map(String::trim)
                .filter(line -> !line.isEmpty());
        return Stream.concat(fromArgs, fromList);
    }

    /**
     * 只在呼叫端執行緒依輸入順序呼叫，debug 時位元圖緊接在對應的雜湊行之前。
     */
    private HashReport printReport(HashReport report) {
        if (report.result().isSuccess()) {
            if (config.debug()) {
                out.println();
                out.println(HexEncoder.toBitGrid(report.hash(), report.bits()));
                out.println();
            }
            out.println(report.hash() + "  " + report.path());
        }
        return report;
    }

    static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = Math.min(units.length - 1, (int) (Math.log10(size) / Math.log10(1024)));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }
}
