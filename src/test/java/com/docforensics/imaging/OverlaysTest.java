package com.docforensics.imaging;

import com.docforensics.models.BoundingBox;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OverlaysTest {

    @TempDir
    Path tempDir;

    @Test
    void boxColourFollowsConfidence() {
        assertEquals(Overlays.RED, Overlays.colorFor(70));
        assertEquals(Overlays.ORANGE, Overlays.colorFor(69.99));
        assertEquals(Overlays.ORANGE, Overlays.colorFor(40));
        assertEquals(Overlays.YELLOW, Overlays.colorFor(39.99));

        assertEquals(3, Overlays.thicknessFor(95));
        assertEquals(2, Overlays.thicknessFor(45));
        assertEquals(1, Overlays.thicknessFor(25));
    }

    @Test
    void heatmapBlendsColourMapAndDrawsRegion() {
        Mat original = RasterOps.toBgr(TestImages.uniform(60, 60, Color.BLACK));
        Mat levels = TestImages.blankMap(60, 60);
        List<Overlays.Box> regions = List.of(new Overlays.Box(BoundingBox.of(10, 20, 30, 20), 90, "90%"));

        Mat heatmap = Overlays.errorLevelHeatmap(original, levels, regions);

        assertEquals(CvType.CV_8UC3, heatmap.type());
        assertEquals(60, heatmap.rows());
        // нулевая ошибка в палитре JET - темно-синий, смешанный с черным наполовину
        double[] background = heatmap.get(55, 55);
        assertTrue(background[0] > 50 && background[2] < 10, "Фон: " + java.util.Arrays.toString(background));
        // красная рамка уверенной области (BGR)
        assertArrayEquals(new double[]{0, 0, 255}, heatmap.get(30, 10), 1e-9);
    }

    @Test
    void textRegionsLeaveSourceUntouched() {
        Mat original = RasterOps.toBgr(TestImages.uniform(50, 50, Color.WHITE));

        Mat overlay = Overlays.textRegions(original,
            List.of(new Overlays.Box(BoundingBox.of(5, 15, 20, 10), 50, "Total")));

        assertArrayEquals(new double[]{0, 165, 255}, overlay.get(20, 5), 1e-9);
        assertArrayEquals(new double[]{255, 255, 255}, original.get(20, 5), 1e-9);
    }

    @Test
    void pngIsWrittenIntoNewDirectory() throws Exception {
        Mat image = RasterOps.toBgr(TestImages.noise(16, 12, 5L));
        Path target = tempDir.resolve("visual").resolve(Overlays.fileName("scan 01/a", "ela_heatmap"));

        Overlays.writePng(image, target);

        assertTrue(Files.isRegularFile(target));
        assertEquals("scan_01_a_ela_heatmap.png", target.getFileName().toString());
        BufferedImage read = ImageIO.read(target.toFile());
        assertEquals(16, read.getWidth());
        assertEquals(12, read.getHeight());
    }
}
