package com.docforensics.reports;

import com.docforensics.models.FusionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;
    private final ForensicReportFormatter formatter;

    public JsonReportGenerator(ForensicReportFormatter formatter) {
        this.formatter = formatter;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(FusionResult result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        // КРИТИЧНО: Защита от NPE
        if (result == null) {
            throw new IllegalArgumentException("FusionResult не может быть null");
        }

        Files.writeString(outputPath, toJson(result));
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    /**
     * Сериализовать результат в каноническую JSON структуру
     */
    public String toJson(FusionResult result) throws IOException {
        return objectMapper.writeValueAsString(formatter.format(result));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
