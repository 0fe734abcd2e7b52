package work.pollochang.hash.image.cache;

/**
 * 雜湊快取的 Value。
 * @param lastModified 計算時檔案的最後修改時間 (毫秒)
 * @param fileSize     計算時檔案大小
 * @param hash         十六進位雜湊
 */
public record CachedHash(long lastModified, long fileSize, String hash) {

    /**
     * 檔案自計算後未變動才可重用。
     */
    public boolean matches(long lastModified, long fileSize) {
        return this.lastModified == lastModified && this.fileSize == fileSize;
    }
}
