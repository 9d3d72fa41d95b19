package com.docforensics.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.GpsDirectory;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Чтение EXIF (metadata-extractor) и размеров изображения (ImageIO, без декодирования растра)
 */
@Slf4j
public class ImageMetadataExtractor {

    public ImageMetadata extract(Path path) throws IOException {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(path.toFile());
        } catch (ImageProcessingException e) {
            throw new IOException("Не удалось прочитать метаданные изображения: " + e.getMessage(), e);
        }

        ImageMetadata.ImageMetadataBuilder builder = ImageMetadata.builder();

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 != null) {
            builder.dateTime(ifd0.getString(ExifDirectoryBase.TAG_DATETIME))
                .make(ifd0.getString(ExifDirectoryBase.TAG_MAKE))
                .model(ifd0.getString(ExifDirectoryBase.TAG_MODEL))
                .software(ifd0.getString(ExifDirectoryBase.TAG_SOFTWARE));
        }

        int exifTags = 0;
        for (Directory directory : metadata.getDirectories()) {
            if (directory instanceof ExifDirectoryBase) {
                exifTags += directory.getTagCount();
            }
            if (directory instanceof GpsDirectory) {
                for (Tag tag : directory.getTags()) {
                    builder.gpsTag(tag.getTagName());
                }
            }
        }
        builder.exifTagCount(exifTags);

        readDimensions(path, builder);
        ImageMetadata result = builder.build();
        log.debug("EXIF {}: тегов {}, размер {}x{}", path.getFileName(), exifTags,
            result.getWidth(), result.getHeight());
        return result;
    }

    private static void readDimensions(Path path, ImageMetadata.ImageMetadataBuilder builder) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                throw new IOException("Не удалось открыть изображение: " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("Неподдерживаемый формат изображения: " + path);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                builder.format(reader.getFormatName())
                    .width(reader.getWidth(0))
                    .height(reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }
}
