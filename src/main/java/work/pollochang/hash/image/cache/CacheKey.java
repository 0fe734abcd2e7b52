package work.pollochang.hash.image.cache;

/**
 * 雜湊快取的 Key。
 * @param path   檔案的絕對路徑
 * @param params 影響雜湊結果的參數摘要 (見 {@code BlockhashConfig#fingerprint()})
 */
public record CacheKey(String path, String params) {}
