package work.pollochang.hash.image.core;

public enum HashResult {
    HASHED("成功計算"),
    CACHED("使用快取"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_UNSUPPORTED_FORMAT("格式不支援"),
    FAILED_UNSUPPORTED_MODE("影像模式不支援"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    HashResult(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isSuccess() {
        return this == HASHED || this == CACHED;
    }
}
