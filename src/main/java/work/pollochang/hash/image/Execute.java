package work.pollochang.hash.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import work.pollochang.hash.image.core.BlockhashConfig;
import work.pollochang.hash.image.core.ImageSize;
import work.pollochang.hash.image.core.Interpolation;
import work.pollochang.hash.image.core.InvalidConfigurationException;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "blockhash",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "區塊平均值感知雜湊 (blockhash) 計算工具")
public class Execute implements Callable<Integer> {

    static final int EXIT_INVALID_CONFIGURATION = 2;

    @Option(names = {"--quick"}, defaultValue = "false", arity = "0..1", description = "使用快速 (整除切塊) 雜湊方法 (預設: false)。")
    private boolean quick;

    @Option(names = {"--bits"}, defaultValue = "16", description = "產生 N^2 位元的雜湊，N 為 2~4096 的偶數 (預設: 16)。")
    private int bits;

    @Option(names = {"--size"}, description = "雜湊前先縮放至指定尺寸，例如 256x256。")
    private String size;

    @Option(names = {"--interpolation"}, defaultValue = "1", description = "縮放插值方法: 1 - 最近鄰, 2 - 雙線性, 3 - 雙三次, 4 - 抗鋸齒 (預設: 1)。")
    private int interpolation;

    @Option(names = {"--debug"}, description = "以 2D 位元圖輸出雜湊 (除錯用)。")
    private boolean debug;

    @Option(names = {"-f", "--file-list"}, description = "包含圖片路徑的文字檔案，每行一個。")
    private File fileList;

    @Option(names = {"--threads"}, defaultValue = "1", description = "同時計算的執行緒數量 (預設: 1)。")
    private int threads;

    @Option(names = {"--json"}, description = "將結果另存為 JSON 報告。")
    private File jsonReport;

    @Option(names = {"--cache-db"}, description = "H2 雜湊快取資料庫的檔案路徑。")
    private File h2DbFile;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "要計算雜湊的圖片。")
    private List<String> filenames = new ArrayList<>();

    @Override
    public Integer call() {
        final BlockhashConfig config;
        try {
            config = new BlockhashConfig(
                    quick,
                    bits,
                    size == null ? null : ImageSize.parse(size),
                    Interpolation.fromCode(interpolation),
                    debug
            );
        } catch (InvalidConfigurationException e) {
            log.error("參數設定錯誤: {}", e.getMessage());
            return EXIT_INVALID_CONFIGURATION;
        }

        if (filenames.isEmpty() && fileList == null) {
            log.error("請指定至少一個圖片檔案或使用 --file-list。");
            return EXIT_INVALID_CONFIGURATION;
        }

        log.info("========================================雜湊參數設定========================================");
        log.info("雜湊位元: {}x{} (雜湊長度 {} 字元)", config.bits(), config.bits(), config.hashLength());
        log.info("快速模式: {}", config.quick());
        log.info("縮放尺寸: {}", config.size() == null ? "不縮放" : config.size() + " (" + config.interpolation().getDescription() + ")");
        log.info("執行緒數量: {}", threads);
        if (fileList != null) {
            log.info("來源列表: {}", fileList.getAbsolutePath());
        }
        if (h2DbFile != null) {
            log.info("雜湊快取資料庫: {}", h2DbFile.getAbsolutePath());
        }
        log.info("========================================雜湊參數設定========================================");

        HashBatch hashBatch = new HashBatch();
        hashBatch.setFilenames(filenames);
        hashBatch.setFileListPath(fileList == null ? null : fileList.toPath());
        hashBatch.setConfig(config);
        hashBatch.setThreads(Math.max(1, threads));
        hashBatch.setCachePath(h2DbFile == null ? null : h2DbFile.toPath());
        hashBatch.setReportPath(jsonReport == null ? null : jsonReport.toPath());
        return hashBatch.execute();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
