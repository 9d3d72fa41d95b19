package com.docforensics.ocr;

import com.docforensics.imaging.RasterOps;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;

/**
 * Подготовка изображения к OCR: серый, адаптивный порог, расширение, медианный фильтр
 */
public final class OcrPreprocessor {

    static final int THRESHOLD_BLOCK_SIZE = 11;
    static final double THRESHOLD_C = 2.0;
    static final int DILATION_KERNEL = 1;
    static final int MEDIAN_APERTURE = 3;

    private OcrPreprocessor() {
    }

    public static BufferedImage prepare(BufferedImage image) {
        Mat bgr = RasterOps.toBgr(image);
        Mat gray = new Mat();
        Mat binary = new Mat();
        Mat kernel = Mat.ones(DILATION_KERNEL, DILATION_KERNEL, CvType.CV_8U);
        Mat dilated = new Mat();
        Mat denoised = new Mat();
        try {
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.adaptiveThreshold(gray, binary, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY,
                THRESHOLD_BLOCK_SIZE, THRESHOLD_C);
            Imgproc.dilate(binary, dilated, kernel);
            Imgproc.medianBlur(dilated, denoised, MEDIAN_APERTURE);
            return RasterOps.toBufferedImage(denoised);
        } finally {
            bgr.release();
            gray.release();
            binary.release();
            kernel.release();
            dilated.release();
            denoised.release();
        }
    }
}
