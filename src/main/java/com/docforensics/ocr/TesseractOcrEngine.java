package com.docforensics.ocr;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.models.BoundingBox;
import com.sun.jna.Pointer;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITessAPI.TessBaseAPI;
import net.sourceforge.tess4j.ITessAPI.TessPageIterator;
import net.sourceforge.tess4j.ITessAPI.TessPageIteratorLevel;
import net.sourceforge.tess4j.ITessAPI.TessResultIterator;
import net.sourceforge.tess4j.TessAPI1;
import net.sourceforge.tess4j.util.ImageIOHelper;

import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * OCR на Tesseract (Tess4J, TessAPI1).
 * Распознавание выполняется один раз; слова, номера строк и блоков читаются
 * одним проходом итератора результатов.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final String dataPath;

    public TesseractOcrEngine(ForensicsConfig.Ocr config) {
        this.dataPath = config.getDataPath();
    }

    @Override
    public List<OcrWord> detect(BufferedImage image, OcrOptions options) {
        // Дескриптор TessBaseAPI не потокобезопасен - создаем на каждый вызов
        TessBaseAPI handle;
        try {
            handle = TessAPI1.TessBaseAPICreate();
        } catch (RuntimeException | LinkageError e) {
            throw new OcrException("OCR engine failure: " + e.getMessage(), e);
        }
        try {
            String path = dataPath != null && !dataPath.isBlank() ? dataPath : null;
            if (TessAPI1.TessBaseAPIInit2(handle, path, options.getLanguage(), options.getOcrEngineMode()) != 0) {
                throw new OcrException("OCR engine failure: could not initialize language "
                    + options.getLanguage());
            }
            TessAPI1.TessBaseAPISetPageSegMode(handle, options.getPageSegmentationMode());

            ByteBuffer data = ImageIOHelper.convertImageData(image);
            int bitsPerPixel = image.getColorModel().getPixelSize();
            int bytesPerLine = (int) Math.ceil(image.getWidth() * bitsPerPixel / 8.0);
            TessAPI1.TessBaseAPISetImage(handle, data, image.getWidth(), image.getHeight(),
                bitsPerPixel / 8, bytesPerLine);

            if (TessAPI1.TessBaseAPIRecognize(handle, null) != 0) {
                throw new OcrException("OCR engine failure: recognition failed");
            }
            List<OcrWord> words = readWords(handle);
            log.debug("Tesseract распознал {} слов", words.size());
            return words;
        } catch (RuntimeException | LinkageError e) {
            if (e instanceof OcrException) {
                throw (OcrException) e;
            }
            throw new OcrException("OCR engine failure: " + e.getMessage(), e);
        } finally {
            TessAPI1.TessBaseAPIEnd(handle);
            TessAPI1.TessBaseAPIDelete(handle);
        }
    }

    private static List<OcrWord> readWords(TessBaseAPI handle) {
        List<OcrWord> words = new ArrayList<>();
        TessResultIterator ri = TessAPI1.TessBaseAPIGetIterator(handle);
        if (ri == null) {
            // пустая страница
            return words;
        }
        try {
            TessPageIterator pi = TessAPI1.TessResultIteratorGetPageIterator(ri);
            TessAPI1.TessPageIteratorBegin(pi);
            int lineId = -1;
            int blockId = -1;
            IntBuffer left = IntBuffer.allocate(1);
            IntBuffer top = IntBuffer.allocate(1);
            IntBuffer right = IntBuffer.allocate(1);
            IntBuffer bottom = IntBuffer.allocate(1);
            do {
                if (TessAPI1.TessPageIteratorIsAtBeginningOf(pi, TessPageIteratorLevel.RIL_BLOCK) == ITessAPI.TRUE) {
                    blockId++;
                }
                if (TessAPI1.TessPageIteratorIsAtBeginningOf(pi, TessPageIteratorLevel.RIL_TEXTLINE) == ITessAPI.TRUE) {
                    lineId++;
                }
                Pointer text = TessAPI1.TessResultIteratorGetUTF8Text(ri, TessPageIteratorLevel.RIL_WORD);
                if (text == null) {
                    continue;
                }
                String value = text.getString(0);
                TessAPI1.TessDeleteText(text);
                float confidence = TessAPI1.TessResultIteratorConfidence(ri, TessPageIteratorLevel.RIL_WORD);

                left.clear();
                top.clear();
                right.clear();
                bottom.clear();
                TessAPI1.TessPageIteratorBoundingBox(pi, TessPageIteratorLevel.RIL_WORD, left, top, right, bottom);
                int x = left.get(0);
                int y = top.get(0);
                words.add(new OcrWord(BoundingBox.of(x, y, right.get(0) - x, bottom.get(0) - y),
                    value, confidence, lineId, blockId));
            } while (TessAPI1.TessPageIteratorNext(pi, TessPageIteratorLevel.RIL_WORD) == ITessAPI.TRUE);
        } finally {
            TessAPI1.TessResultIteratorDelete(ri);
        }
        return words;
    }
}
