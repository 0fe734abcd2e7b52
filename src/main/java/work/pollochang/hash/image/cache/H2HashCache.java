package work.pollochang.hash.image.cache;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 雜湊快取管理器。
 * 負責所有與 H2 資料庫的底層互動，包括連線、資料表初始化、讀取與批次儲存。
 */
@Slf4j
public class H2HashCache implements AutoCloseable {

    private final Connection connection;

    // 使用 MERGE 陳述式來實現 "upsert" (update or insert) 功能。
    private static final String MERGE_SQL = "MERGE INTO BLOCKHASH_CACHE (FILE_PATH, PARAMS, LAST_MODIFIED, FILE_SIZE, HASH_VALUE) " +
            "KEY(FILE_PATH, PARAMS) VALUES (?, ?, ?, ?, ?)";

    /**
     * 建構子，開啟 (必要時建立) H2 資料庫。
     * @param dbPath H2 資料庫檔案的路徑，可含或不含 .mv.db 副檔名。
     */
    public H2HashCache(Path dbPath) {
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        String jdbcUrl = String.format("jdbc:h2:%s", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 初始化資料庫，如果資料表不存在，則建立它。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS BLOCKHASH_CACHE (" +
                "FILE_PATH VARCHAR(4096), " +
                "PARAMS VARCHAR(255), " +
                "LAST_MODIFIED BIGINT, " +
                "FILE_SIZE BIGINT, " +
                "HASH_VALUE VARCHAR(4096), " +
                "PRIMARY KEY (FILE_PATH, PARAMS)" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("H2 資料表 'BLOCKHASH_CACHE' 已確認存在。");
        } catch (SQLException e) {
            throw new IllegalStateException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 從 H2 資料庫讀取所有快取紀錄，並載入到一個記憶體 Map 中。
     * @return 包含所有快取資料的 ConcurrentHashMap。
     */
    public Map<CacheKey, CachedHash> loadAllToMap() {
        Map<CacheKey, CachedHash> cache = new ConcurrentHashMap<>();
        String selectSql = "SELECT FILE_PATH, PARAMS, LAST_MODIFIED, FILE_SIZE, HASH_VALUE FROM BLOCKHASH_CACHE";

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {

            while (rs.next()) {
                CacheKey key = new CacheKey(rs.getString("FILE_PATH"), rs.getString("PARAMS"));
                CachedHash value = new CachedHash(
                        rs.getLong("LAST_MODIFIED"),
                        rs.getLong("FILE_SIZE"),
                        rs.getString("HASH_VALUE")
                );
                cache.put(key, value);
            }
        } catch (SQLException e) {
            log.error("從 H2 載入快取時發生錯誤", e);
            // 即使載入失敗，也返回一個空的 map，讓程式可以繼續執行
            return new ConcurrentHashMap<>();
        }
        log.info("從 H2 資料庫成功載入 {} 筆雜湊快取紀錄。", cache.size());
        return cache;
    }

    /**
     * 將記憶體中的快取 Map 以單一交易批次儲存回 H2 資料庫。
     * @param cache 要儲存的快取 Map。
     */
    public void saveAllFromMap(Map<CacheKey, CachedHash> cache) {
        if (cache == null || cache.isEmpty()) {
            log.info("記憶體快取為空，無需儲存至 H2。");
            return;
        }

        log.info("準備將 {} 筆快取紀錄批次寫入 H2 資料庫...", cache.size());
        int batchSize = 0;
        final int MAX_BATCH_SIZE = 1000; // 每 1000 筆執行一次

        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            connection.setAutoCommit(false);

            for (Map.Entry<CacheKey, CachedHash> entry : cache.entrySet()) {
                CacheKey key = entry.getKey();
                CachedHash value = entry.getValue();

                ps.setString(1, key.path());
                ps.setString(2, key.params());
                ps.setLong(3, value.lastModified());
                ps.setLong(4, value.fileSize());
                ps.setString(5, value.hash());
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄儲存/更新至 H2 資料庫。", batchSize);

        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            try {
                connection.rollback();
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        try {
            log.info("正在關閉 H2 資料庫連線...");
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
