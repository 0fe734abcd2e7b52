package work.pollochang.hash.image.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.pollochang.hash.image.core.HashResult;

/**
 * 單一檔案的雜湊結果。
 * @param path   命令列或檔案列表中原樣的路徑
 * @param result 處理結果
 * @param hash   十六進位雜湊，失敗時為 {@code null}
 * @param bits   區塊格邊長
 * @param size   原始檔案大小 (bytes)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HashReport(String path, HashResult result, String hash, int bits, long size) {

    public static HashReport failed(String path, HashResult result, int bits, long size) {
        return new HashReport(path, result, null, bits, size);
    }
}
