package com.docforensics.metadata;

import com.docforensics.imaging.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MediaTypeDetectorTest {

    @TempDir
    Path tempDir;

    @Test
    void detectsPngByContent() throws Exception {
        Path png = TestImages.writePng(TestImages.noise(20, 20, 3L), tempDir.resolve("scan.png"));

        assertEquals(MediaTypeDetector.PNG, MediaTypeDetector.detect(png));
    }

    @Test
    void contentWinsOverExtension() throws Exception {
        Path disguised = TestImages.writePng(TestImages.noise(20, 20, 4L), tempDir.resolve("photo.jpg"));

        assertEquals(MediaTypeDetector.PNG, MediaTypeDetector.detect(disguised));
    }

    @Test
    void detectsPdfMagic() throws Exception {
        Path pdf = tempDir.resolve("report.bin");
        Files.write(pdf, "%PDF-1.7\n%âã\n".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals(MediaTypeDetector.PDF, MediaTypeDetector.detect(pdf));
    }

    @Test
    void unknownContentFallsBackToExtension() throws Exception {
        Path text = tempDir.resolve("notes.txt");
        Files.writeString(text, "plain text");

        assertEquals(MediaTypeDetector.UNKNOWN, MediaTypeDetector.detect(text));
    }

    @Test
    void extensionIsLowercasedWithDot() {
        assertEquals(".jpg", MediaTypeDetector.extensionOf(Paths.get("/tmp/SCAN.JPG")));
        assertEquals("", MediaTypeDetector.extensionOf(Paths.get("README")));
        assertEquals(MediaTypeDetector.JPEG, MediaTypeDetector.byExtension(Paths.get("a.jpeg")));
        assertEquals(MediaTypeDetector.UNKNOWN, MediaTypeDetector.byExtension(Paths.get("a.tiff")));
    }

    @Test
    void typePredicates() {
        assertTrue(MediaTypeDetector.isImage("image/png"));
        assertFalse(MediaTypeDetector.isImage(MediaTypeDetector.PDF));
        assertTrue(MediaTypeDetector.isPdf(MediaTypeDetector.PDF));
        assertFalse(MediaTypeDetector.isPdf(null));
    }
}
