package ai.designerkit.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class SourceFilesTest {

    @Test
    void testReadStripsAndReportsBom(@TempDir Path tempDir) throws IOException {
        var file = tempDir.resolve("a.cs");
        Files.write(file, new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '\n'});

        var source = SourceFiles.read(file);

        assertTrue(source.hadBom());
        assertEquals("x\n", source.text());
    }

    @Test
    void testOverwriteReplacesContentWithoutLeftovers(@TempDir Path tempDir) throws IOException {
        var file = Files.writeString(tempDir.resolve("Main.Designer.cs"), "old content, longer than the new");

        SourceFiles.write(file, "new", true);

        assertEquals("new", SourceFiles.read(file).text());
        assertTrue(SourceFiles.read(file).hadBom());
        try (var entries = Files.list(tempDir)) {
            assertEquals(List.of(file), entries.toList());
        }
    }

    @Test
    void testFailedWriteRemovesTemporaryFile(@TempDir Path tempDir) throws IOException {
        var occupied = Files.createDirectories(tempDir.resolve("Main.Designer.cs"));
        Files.writeString(occupied.resolve("keep.txt"), "x");

        assertThrows(IOException.class, () -> SourceFiles.write(occupied, "text", false));

        try (var entries = Files.list(tempDir)) {
            assertEquals(List.of(occupied), entries.toList());
        }
        assertEquals("x", Files.readString(occupied.resolve("keep.txt")));
    }

    @Test
    void testWriteAddsBomOnlyWhenAsked(@TempDir Path tempDir) throws IOException {
        var with = tempDir.resolve("with.cs");
        var without = tempDir.resolve("nested").resolve("without.cs");

        SourceFiles.write(with, "é", true);
        SourceFiles.write(without, "é", false);

        assertArrayEquals(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, (byte) 0xC3, (byte) 0xA9},
                Files.readAllBytes(with));
        assertArrayEquals("é".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(without));
    }

    @Test
    void testStripFromDecodedText() {
        assertEquals("abc", SourceFiles.stripUtf8Bom("\uFEFFabc"));
        assertEquals("abc", SourceFiles.stripUtf8Bom("abc"));
        assertEquals("", SourceFiles.stripUtf8Bom(""));
    }

    @Test
    void testLineSeparatorDetection() {
        assertEquals("\r\n", SourceFiles.lineSeparatorOf("a\r\nb"));
        assertEquals("\n", SourceFiles.lineSeparatorOf("a\nb"));
        assertEquals("\n", SourceFiles.lineSeparatorOf("single line"));
    }

    @Test
    void testInterruptedReadIsCancelled(@TempDir Path tempDir) throws IOException {
        var file = Files.writeString(tempDir.resolve("a.vb"), "x");
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> SourceFiles.read(file));
        } finally {
            Thread.interrupted();
        }
    }
}
