package ai.designerkit.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CancellationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reading and writing designer sources as UTF-8 text while keeping track of a leading byte order mark. */
public final class SourceFiles {
    private static final Logger logger = LogManager.getLogger(SourceFiles.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private SourceFiles() {}

    /** File content with the BOM removed, plus whether one was there. */
    public record SourceText(String text, boolean hadBom) {}

    /**
     * Reads the whole file. This is the one point where a designer operation checks for cancellation: an interrupted
     * caller gets a {@link CancellationException} and nothing is parsed.
     */
    public static SourceText read(Path file) throws IOException {
        checkCancelled(file);
        byte[] bytes = Files.readAllBytes(file);
        checkCancelled(file);
        boolean bom = hasUtf8Bom(bytes);
        logger.debug("Read {} ({} bytes{})", file, bytes.length, bom ? ", BOM" : "");
        return new SourceText(new String(stripUtf8Bom(bytes), StandardCharsets.UTF_8), bom);
    }

    /**
     * Replaces the file's content. The bytes go to a temporary file in the same directory first, which is then moved
     * over the target, so a failed write never leaves a truncated designer file behind.
     */
    public static void write(Path file, String text, boolean withBom) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        if (withBom) {
            byte[] out = new byte[body.length + UTF8_BOM.length];
            System.arraycopy(UTF8_BOM, 0, out, 0, UTF8_BOM.length);
            System.arraycopy(body, 0, out, UTF8_BOM.length, body.length);
            body = out;
        }
        var target = file.toAbsolutePath();
        var parent = target.getParent();
        Files.createDirectories(parent);

        Path tempFile = Files.createTempFile(parent, "designer-", ".tmp");
        try {
            Files.write(tempFile, body);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to a plain move", target);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
        logger.debug("Wrote {} ({} bytes)", file, body.length);
    }

    public static boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF;
    }

    /** Strips a leading UTF-8 BOM (EF BB BF); returns the original array when there is none. */
    public static byte[] stripUtf8Bom(byte[] bytes) {
        if (hasUtf8Bom(bytes)) {
            byte[] withoutBom = new byte[bytes.length - 3];
            System.arraycopy(bytes, 3, withoutBom, 0, bytes.length - 3);
            return withoutBom;
        }
        return bytes;
    }

    /** Strips a leading U+FEFF from already-decoded text. */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /** {@code "\r\n"} when the text uses CRLF line endings, {@code "\n"} otherwise. */
    public static String lineSeparatorOf(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    private static void checkCancelled(Path file) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted before reading " + file);
        }
    }
}
