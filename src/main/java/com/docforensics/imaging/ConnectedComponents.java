package com.docforensics.imaging;

import com.docforensics.models.BoundingBox;
import lombok.Value;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Выделение 8-связных компонент в бинарной маске
 */
public final class ConnectedComponents {

    private static final int CONNECTIVITY = 8;

    private ConnectedComponents() {
    }

    @Value
    public static class Component {
        int area;
        BoundingBox bbox;
        /** Сумма значений карты интенсивности по пикселям компоненты */
        long intensitySum;

        public double getMeanIntensity() {
            return area > 0 ? (double) intensitySum / area : 0.0;
        }
    }

    /**
     * Найти компоненты маски; интенсивность считается по карте intensity того же размера.
     * Обе карты - CV_8UC1, фон маски - 0.
     */
    public static List<Component> label(Mat mask, Mat intensity) {
        if (intensity.type() != CvType.CV_8UC1 || mask.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Ожидаются одноканальные 8-битные карты");
        }
        if (mask.rows() != intensity.rows() || mask.cols() != intensity.cols()) {
            throw new IllegalArgumentException("Размеры маски и карты интенсивности не совпадают");
        }
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        try {
            int count = Imgproc.connectedComponentsWithStats(mask, labels, stats, centroids,
                CONNECTIVITY, CvType.CV_32S);

            int[] labelData = new int[(int) labels.total()];
            labels.get(0, 0, labelData);
            byte[] values = new byte[(int) intensity.total()];
            intensity.get(0, 0, values);

            long[] sums = new long[count];
            for (int i = 0; i < labelData.length; i++) {
                if (labelData[i] > 0) {
                    sums[labelData[i]] += values[i] & 0xFF;
                }
            }

            // метка 0 - фон
            List<Component> components = new ArrayList<>(Math.max(0, count - 1));
            for (int label = 1; label < count; label++) {
                components.add(new Component(
                    stat(stats, label, Imgproc.CC_STAT_AREA),
                    BoundingBox.of(
                        stat(stats, label, Imgproc.CC_STAT_LEFT),
                        stat(stats, label, Imgproc.CC_STAT_TOP),
                        stat(stats, label, Imgproc.CC_STAT_WIDTH),
                        stat(stats, label, Imgproc.CC_STAT_HEIGHT)),
                    sums[label]));
            }
            return components;
        } finally {
            labels.release();
            stats.release();
            centroids.release();
        }
    }

    private static int stat(Mat stats, int label, int column) {
        return (int) stats.get(label, column)[0];
    }
}
