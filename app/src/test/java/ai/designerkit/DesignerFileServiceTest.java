package ai.designerkit;

import static org.junit.jupiter.api.Assertions.*;

import ai.designerkit.analyzer.Dialect;
import ai.designerkit.model.ControlNode;
import ai.designerkit.model.FormDocument;
import ai.designerkit.testutil.DesignerFixtures;
import ai.designerkit.util.SourceFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class DesignerFileServiceTest {
    private final DesignerFileService service = new DesignerFileService();

    @Test
    void testDialectDetection() {
        assertEquals(Dialect.CSHARP, service.detectDialect(Path.of("Main.Designer.cs")));
        assertEquals(Dialect.VISUAL_BASIC, service.detectDialect(Path.of("dir", "MAIN.DESIGNER.VB")));
        assertThrows(IllegalArgumentException.class, () -> service.detectDialect(Path.of("Main.resx")));
    }

    @Test
    void testUpdateWritesTheEditedModel(@TempDir Path tempDir) throws IOException {
        var file = DesignerFixtures.copyTo(tempDir, DesignerFixtures.SAMPLE_CS);

        var returned = service.update(file, document -> {
            document.findNode("button1").orElseThrow().setProperty("Text", "\"Go\"");
            return "done";
        });

        assertEquals("done", returned);
        assertEquals("\"Go\"", service.parse(file).findNode("button1").orElseThrow().getProperty("Text"));
    }

    @Test
    void testFailedEditLeavesFileUntouched(@TempDir Path tempDir) throws IOException {
        var file = DesignerFixtures.copyTo(tempDir, DesignerFixtures.SAMPLE_VB);
        var before = Files.readAllBytes(file);

        assertThrows(IllegalStateException.class, () -> service.update(file, document -> {
            document.removeNode("Panel1");
            throw new IllegalStateException("abort");
        }));

        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void testByteOrderMarkIsPreserved(@TempDir Path tempDir) throws IOException {
        var file = tempDir.resolve("Bom.Designer.cs");
        SourceFiles.write(file, DesignerFixtures.read(DesignerFixtures.SAMPLE_CS), true);

        service.update(file, document -> {
            document.setFormProperty("Text", "\"With BOM\"");
            return null;
        });

        var bytes = Files.readAllBytes(file);
        assertTrue(SourceFiles.hasUtf8Bom(bytes));
        assertFalse(SourceFiles.hasUtf8Bom(SourceFiles.stripUtf8Bom(bytes)));
        assertEquals("\"With BOM\"", service.parse(file).getFormProperties().get("Text"));
    }

    @Test
    void testWritingANewFileGeneratesItWhole(@TempDir Path tempDir) throws IOException {
        var document = new FormDocument(Dialect.VISUAL_BASIC, null, "Fresh", "Tools.Ui");
        var ok = document.addNode(new ControlNode("OkButton", "System.Windows.Forms.Button"));
        ok.setProperty("Text", "\"OK\"");
        document.attach(null, ok);
        var file = tempDir.resolve("sub").resolve("Fresh.Designer.vb");

        service.write(file, document);

        var text = DesignerFixtures.readFile(file);
        assertTrue(text.startsWith("Namespace Tools.Ui\n"));
        assertTrue(text.contains("Friend WithEvents OkButton As System.Windows.Forms.Button"));
        var reparsed = service.parse(file);
        assertEquals("Fresh", reparsed.getFormName());
        assertEquals("\"OK\"", reparsed.findNode("OkButton").orElseThrow().getProperty("Text"));
    }

    @Test
    void testUnlocatableRegionFallsBackToFullGeneration(@TempDir Path tempDir) throws IOException {
        var file = DesignerFixtures.write(tempDir, "Lost.Designer.cs", "// InitializeComponent went missing\n");
        var document = new FormDocument(Dialect.CSHARP, file, "Lost", null);
        document.setFormProperty("Text", "\"Found\"");

        service.write(file, document);

        var text = DesignerFixtures.readFile(file);
        assertFalse(text.contains("went missing"));
        assertTrue(text.startsWith("partial class Lost\n"));
        assertEquals("\"Found\"", service.parse(file).getFormProperties().get("Text"));
    }

    @Test
    void testDialectMismatchIsRejected(@TempDir Path tempDir) {
        var document = new FormDocument(Dialect.CSHARP, null, "Form1", null);
        assertThrows(
                IllegalArgumentException.class, () -> service.write(tempDir.resolve("Form1.Designer.vb"), document));
    }

    @Test
    void testConcurrentUpdatesToOneFileAreSerialised(@TempDir Path tempDir) throws Exception {
        var file = DesignerFixtures.copyTo(tempDir, DesignerFixtures.SAMPLE_CS);
        var executor = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<Object>>();
            for (int i = 0; i < 8; i++) {
                var name = "extra" + i;
                Callable<Object> task = () -> service.update(file, document -> {
                    var node = document.addNode(new ControlNode(name, "System.Windows.Forms.Label"));
                    document.attach(null, node);
                    return name;
                });
                futures.add(executor.submit(task));
            }
            for (var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        var document = service.parse(file);
        assertEquals(13, document.getAllNodes().size());
        for (int i = 0; i < 8; i++) {
            assertTrue(document.findNode("extra" + i).isPresent(), "extra" + i);
        }
    }
}
