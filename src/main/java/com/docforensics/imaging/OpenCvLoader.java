package com.docforensics.imaging;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;

/**
 * Однократная загрузка нативной библиотеки OpenCV из jar (org.openpnp:opencv)
 */
@Slf4j
public final class OpenCvLoader {

    private static volatile boolean loaded;

    private OpenCvLoader() {
    }

    /**
     * @throws IllegalStateException если нативная библиотека недоступна на этой платформе
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded) {
                return;
            }
            try {
                nu.pattern.OpenCV.loadLocally();
            } catch (RuntimeException | LinkageError e) {
                throw new IllegalStateException("OpenCV недоступен: " + e.getMessage(), e);
            }
            loaded = true;
            log.info("Библиотека OpenCV {} загружена", Core.VERSION);
        }
    }
}
