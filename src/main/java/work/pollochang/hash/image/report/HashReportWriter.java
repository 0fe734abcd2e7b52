package work.pollochang.hash.image.report;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 以 JSON 陣列輸出批次雜湊報告。
 */
@Slf4j
public class HashReportWriter {

    private final ObjectMapper mapper;

    public HashReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 將報告寫入檔案，必要時建立上層目錄。
     * @param path    報告檔路徑
     * @param reports 依輸入順序排列的結果
     * @throws IOException 寫入失敗
     */
    public void write(Path path, List<HashReport> reports) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            log.info("{} - 報告目錄已建立", parent);
        }
        log.info("正在將 {} 筆雜湊結果寫入 {} ...", reports.size(), path);
        mapper.writeValue(path.toFile(), reports);
        log.info("報告成功儲存。");
    }

    public List<HashReport> read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), new TypeReference<>() {});
    }
}
