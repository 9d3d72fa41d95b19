package com.docforensics.imaging;

import com.docforensics.models.BoundingBox;
import lombok.Value;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Визуализации для ручной проверки: тепловая карта ELA и рамки текстовых областей OCR.
 * Цвет рамки зависит от уверенности: от 70 красный, от 40 оранжевый, ниже желтый.
 */
public final class Overlays {

    static final double HEATMAP_ALPHA = 0.5;
    static final double HIGH_CONFIDENCE = 70.0;
    static final double MEDIUM_CONFIDENCE = 40.0;

    // BGR
    static final Scalar RED = new Scalar(0, 0, 255);
    static final Scalar ORANGE = new Scalar(0, 165, 255);
    static final Scalar YELLOW = new Scalar(0, 255, 255);

    private Overlays() {
    }

    /**
     * Область для отрисовки с подписью
     */
    @Value
    public static class Box {
        BoundingBox bbox;
        double confidence;
        String label;
    }

    /**
     * Карта ошибок в палитре JET, смешанная с исходным изображением поровну,
     * с рамками подозрительных областей. Толщина рамки растет с уверенностью.
     */
    public static Mat errorLevelHeatmap(Mat bgr, Mat errorLevels, List<Box> regions) {
        Mat heat = new Mat();
        Mat blended = new Mat();
        try {
            Imgproc.applyColorMap(errorLevels, heat, Imgproc.COLORMAP_JET);
            Core.addWeighted(bgr, 1 - HEATMAP_ALPHA, heat, HEATMAP_ALPHA, 0, blended);
        } finally {
            heat.release();
        }
        for (Box region : regions) {
            BoundingBox b = region.getBbox();
            Scalar color = colorFor(region.getConfidence());
            Imgproc.rectangle(blended, new Point(b.getX(), b.getY()), new Point(b.getRight(), b.getBottom()),
                color, thicknessFor(region.getConfidence()));
            double fontScale = Math.max(0.5, Math.min(1.0, b.getWidth() / 200.0));
            Imgproc.putText(blended, region.getLabel(), new Point(b.getX(), b.getY() - 5),
                Imgproc.FONT_HERSHEY_SIMPLEX, fontScale, color, 2);
        }
        return blended;
    }

    /**
     * Копия изображения с рамками распознанных текстовых областей
     */
    public static Mat textRegions(Mat bgr, List<Box> regions) {
        Mat canvas = bgr.clone();
        for (Box region : regions) {
            BoundingBox b = region.getBbox();
            Scalar color = colorFor(region.getConfidence());
            Imgproc.rectangle(canvas, new Point(b.getX(), b.getY()), new Point(b.getRight(), b.getBottom()),
                color, 2);
            if (region.getLabel() != null && !region.getLabel().isEmpty()) {
                Imgproc.putText(canvas, region.getLabel(), new Point(b.getX(), b.getY() - 5),
                    Imgproc.FONT_HERSHEY_SIMPLEX, 0.5, color, 1);
            }
        }
        return canvas;
    }

    /**
     * Сохранить изображение в PNG, создав каталог при необходимости
     */
    public static Path writePng(Mat image, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!Imgcodecs.imwrite(target.toString(), image)) {
            throw new IOException("Не удалось сохранить изображение: " + target);
        }
        return target;
    }

    /**
     * Имя файла визуализации: идентификатор документа без символов, недопустимых в путях
     */
    public static String fileName(String documentId, String suffix) {
        String safe = documentId == null || documentId.isBlank()
            ? "document" : documentId.replaceAll("[^A-Za-z0-9._-]", "_");
        return safe + "_" + suffix + ".png";
    }

    static Scalar colorFor(double confidence) {
        if (confidence >= HIGH_CONFIDENCE) {
            return RED;
        }
        if (confidence >= MEDIUM_CONFIDENCE) {
            return ORANGE;
        }
        return YELLOW;
    }

    static int thicknessFor(double confidence) {
        if (confidence >= HIGH_CONFIDENCE) {
            return 3;
        }
        return confidence >= MEDIUM_CONFIDENCE ? 2 : 1;
    }
}
