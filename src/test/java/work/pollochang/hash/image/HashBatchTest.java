package work.pollochang.hash.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.hash.image.core.BlockhashConfig;
import work.pollochang.hash.image.core.HashResult;
import work.pollochang.hash.image.core.HexEncoder;
import work.pollochang.hash.image.report.HashReport;
import work.pollochang.hash.image.report.HashReportWriter;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class HashBatchTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    /**
     * 產生測試用影像檔
     */
    private Path createTestImage(Path dir, String name, int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
            g.setPaint(Color.BLACK);
            g.fillRect(0, 0, width / 2, height / 3);
        } finally {
            g.dispose();
        }
        Path file = dir.resolve(name);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    private HashBatch newBatch(BlockhashConfig config) {
        HashBatch batch = new HashBatch();
        batch.setConfig(config);
        batch.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        return batch;
    }

    private List<String> outputLines() {
        return stdout.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Test
    void testHashFiles_ShouldPrintHashAndFilenameInInputOrder(@TempDir Path tempDir) throws IOException {
        String white = createTestImage(tempDir, "white.png", 32, 32, Color.WHITE).toString();
        String gray = createTestImage(tempDir, "gray.png", 30, 20, Color.GRAY).toString();

        HashBatch batch = newBatch(BlockhashConfig.defaults().withBits(8));
        batch.setFilenames(List.of(white, gray));

        assertEquals(0, batch.execute());

        List<String> lines = outputLines();
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).matches("[0-9a-f]{16}  " + Pattern.quote(white)), lines.get(0));
        assertTrue(lines.get(1).endsWith("  " + gray));
    }

    /**
     * 找不到的檔案略過，不影響其他檔案，結束碼為 1
     */
    @Test
    void testMissingFile_ShouldBeSkippedAndReported(@TempDir Path tempDir) throws IOException {
        String image = createTestImage(tempDir, "a.png", 16, 16, Color.WHITE).toString();
        String missing = tempDir.resolve("missing.png").toString();
        Path notImage = tempDir.resolve("notes.txt");
        Files.writeString(notImage, "hello");
        Path report = tempDir.resolve("report.json");

        HashBatch batch = newBatch(BlockhashConfig.defaults().withBits(4));
        batch.setFilenames(List.of(missing, image, notImage.toString()));
        batch.setReportPath(report);

        assertEquals(1, batch.execute());
        assertEquals(1, outputLines().size());

        List<HashReport> reports = new HashReportWriter().read(report);
        assertEquals(HashResult.SKIPPED_NOT_FOUND, reports.get(0).result());
        assertEquals(HashResult.HASHED, reports.get(1).result());
        assertEquals(HashResult.FAILED_UNSUPPORTED_FORMAT, reports.get(2).result());
        assertNull(reports.get(2).hash());
    }

    @Test
    void testFileListAndThreads_ShouldMatchSequentialResult(@TempDir Path tempDir) throws IOException {
        StringBuilder list = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            Path file = createTestImage(tempDir, "img" + i + ".png", 20 + i * 7, 15 + i * 3, new Color(i * 40, 200 - i * 30, 90));
            list.append(file).append("\n\n");
        }
        Path fileList = tempDir.resolve("list.txt");
        Files.writeString(fileList, list.toString());

        HashBatch sequential = newBatch(BlockhashConfig.defaults());
        sequential.setFileListPath(fileList);
        assertEquals(0, sequential.execute());
        List<String> expected = outputLines();
        stdout.reset();

        HashBatch parallel = newBatch(BlockhashConfig.defaults());
        parallel.setFileListPath(fileList);
        parallel.setThreads(3);
        assertEquals(0, parallel.execute());

        assertEquals(6, expected.size());
        assertEquals(expected, outputLines());
    }

    /**
     * 第二次執行時未變動的檔案直接使用 H2 快取
     */
    @Test
    void testSecondRunWithCache_ShouldReuseHashes(@TempDir Path tempDir) throws IOException {
        String image = createTestImage(tempDir, "cached.png", 40, 40, Color.PINK).toString();
        Path cacheDb = tempDir.resolve("hash-cache");
        Path report = tempDir.resolve("report.json");

        HashBatch first = newBatch(BlockhashConfig.defaults());
        first.setFilenames(List.of(image));
        first.setCachePath(cacheDb);
        first.setReportPath(report);
        assertEquals(0, first.execute());
        HashReport computed = new HashReportWriter().read(report).get(0);

        HashBatch second = newBatch(BlockhashConfig.defaults());
        second.setFilenames(List.of(image));
        second.setCachePath(cacheDb);
        second.setReportPath(report);
        assertEquals(0, second.execute());
        HashReport cached = new HashReportWriter().read(report).get(0);

        assertEquals(HashResult.HASHED, computed.result());
        assertEquals(HashResult.CACHED, cached.result());
        assertEquals(computed.hash(), cached.hash());

        // 參數不同時不可重用
        HashBatch quick = newBatch(BlockhashConfig.defaults().withQuick(true));
        quick.setFilenames(List.of(image));
        quick.setCachePath(cacheDb);
        quick.setReportPath(report);
        assertEquals(0, quick.execute());
        assertEquals(HashResult.HASHED, new HashReportWriter().read(report).get(0).result());
    }

    @Test
    void testDebug_ShouldPrintBitGridBeforeHashLine(@TempDir Path tempDir) throws IOException {
        String image = createTestImage(tempDir, "debug.png", 16, 16, Color.WHITE).toString();

        HashBatch batch = newBatch(BlockhashConfig.defaults().withBits(4).withDebug(true));
        batch.setFilenames(List.of(image));
        assertEquals(0, batch.execute());

        List<String> lines = outputLines();
        assertEquals(7, lines.size());
        assertEquals("", lines.get(0));
        for (int row = 1; row <= 4; row++) {
            assertTrue(lines.get(row).matches("[01]{4}"), lines.get(row));
        }
        assertEquals("", lines.get(5));
        assertTrue(lines.get(6).endsWith("  " + image));
    }

    /**
     * 多執行緒時每張圖片的位元圖仍緊接在自己的雜湊行之前，與單執行緒輸出相同
     */
    @Test
    void testDebugWithThreads_ShouldKeepBitGridNextToItsHashLine(@TempDir Path tempDir) throws IOException {
        List<String> files = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            files.add(createTestImage(tempDir, "grid" + i + ".png", 16 + i * 5, 12 + i * 3,
                    new Color(255 - i * 30, i * 30, 128)).toString());
        }
        BlockhashConfig config = BlockhashConfig.defaults().withBits(4).withDebug(true);

        HashBatch sequential = newBatch(config);
        sequential.setFilenames(files);
        assertEquals(0, sequential.execute());
        List<String> expected = outputLines();
        stdout.reset();

        HashBatch parallel = newBatch(config);
        parallel.setFilenames(files);
        parallel.setThreads(4);
        assertEquals(0, parallel.execute());
        List<String> lines = outputLines();

        assertEquals(8 * 7, lines.size());
        assertEquals(expected, lines);
        for (int i = 0; i < files.size(); i++) {
            int offset = i * 7;
            String hash = lines.get(offset + 6).substring(0, 4);
            assertEquals(HexEncoder.toBitGrid(hash, 4),
                    String.join("\n", lines.subList(offset + 1, offset + 5)), files.get(i));
            assertTrue(lines.get(offset + 6).endsWith("  " + files.get(i)));
        }
    }

    /**
     * 快取命中的檔案在 debug 時同樣輸出位元圖
     */
    @Test
    void testDebugWithCacheHit_ShouldStillPrintBitGrid(@TempDir Path tempDir) throws IOException {
        String image = createTestImage(tempDir, "hit.png", 24, 24, Color.ORANGE).toString();
        Path cacheDb = tempDir.resolve("hash-cache");
        BlockhashConfig config = BlockhashConfig.defaults().withBits(4).withDebug(true);

        HashBatch first = newBatch(config);
        first.setFilenames(List.of(image));
        first.setCachePath(cacheDb);
        assertEquals(0, first.execute());
        List<String> computed = outputLines();
        stdout.reset();

        HashBatch second = newBatch(config);
        second.setFilenames(List.of(image));
        second.setCachePath(cacheDb);
        second.setThreads(2);
        assertEquals(0, second.execute());

        assertEquals(computed, outputLines());
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0 B", HashBatch.formatFileSize(0));
        assertEquals("512 B", HashBatch.formatFileSize(512));
        assertEquals("2 KB", HashBatch.formatFileSize(2048));
        assertEquals("3 MB", HashBatch.formatFileSize(3L * 1024 * 1024));
    }
}
