package com.docforensics.imaging;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Мост между BufferedImage и Mat плюс операции карты ошибок сжатия.
 * Цветные Mat - CV_8UC3 в порядке BGR, карты - CV_8UC1.
 * Вызывающий освобождает возвращенные Mat.
 */
public final class RasterOps {

    private RasterOps() {
    }

    /**
     * Скопировать изображение в BGR Mat (альфа-канал отбрасывается)
     */
    public static Mat toBgr(BufferedImage source) {
        OpenCvLoader.ensureLoaded();
        BufferedImage bgr = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = bgr.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    /**
     * Обратное преобразование для одно- и трехканальных 8-битных Mat
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        int type;
        if (mat.type() == CvType.CV_8UC1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else if (mat.type() == CvType.CV_8UC3) {
            type = BufferedImage.TYPE_3BYTE_BGR;
        } else {
            throw new IllegalArgumentException("Неподдерживаемый тип Mat: " + CvType.typeToString(mat.type()));
        }
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] data = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, data);
        return image;
    }

    /**
     * Пересжать изображение в JPEG с заданным качеством в памяти и декодировать обратно
     */
    public static Mat jpegRoundTrip(Mat bgr, int quality) {
        MatOfByte encoded = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        try {
            if (!Imgcodecs.imencode(".jpg", bgr, encoded, params)) {
                throw new IllegalStateException("Не удалось сжать изображение в JPEG");
            }
            Mat decoded = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_COLOR);
            if (decoded.empty()) {
                throw new IllegalStateException("Не удалось декодировать пересжатое изображение");
            }
            return decoded;
        } finally {
            encoded.release();
            params.release();
        }
    }

    /**
     * Карта ошибок: поканальная абсолютная разница, перевод в серый и min-max нормализация в 0-255.
     * Плоская разница дает нулевую карту.
     */
    public static Mat errorLevels(Mat original, Mat resaved) {
        if (original.rows() != resaved.rows() || original.cols() != resaved.cols()) {
            throw new IllegalArgumentException("Размеры изображений не совпадают");
        }
        Mat diff = new Mat();
        Mat gray = new Mat();
        try {
            Core.absdiff(original, resaved, diff);
            Imgproc.cvtColor(diff, gray, Imgproc.COLOR_BGR2GRAY);
            Mat normalized = new Mat();
            Core.normalize(gray, normalized, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
            return normalized;
        } finally {
            diff.release();
            gray.release();
        }
    }

    /**
     * Маска пикселей, строго превышающих порог (255 / 0)
     */
    public static Mat threshold(Mat values, int threshold) {
        Mat mask = new Mat();
        Imgproc.threshold(values, mask, threshold, 255, Imgproc.THRESH_BINARY);
        return mask;
    }
}
