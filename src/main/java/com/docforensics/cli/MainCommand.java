package com.docforensics.cli;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.core.ForensicPipeline;
import com.docforensics.models.Finding;
import com.docforensics.models.FusionResult;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;
import com.docforensics.reports.ForensicReportFormatter;
import com.docforensics.reports.JsonReportGenerator;
import com.docforensics.reports.PdfReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Главная CLI команда криминалистического анализа документа
 */
@Slf4j
@Command(
    name = "doc-forensics",
    mixinStandardHelpOptions = true,
    version = "Document Forensics Scanner 1.0.0",
    description = """

        Document Forensics Scanner

        Оценка вероятности подделки отсканированного документа

        Сигналы:
          • Error Level Analysis (артефакты пересжатия)
          • Несогласованность текстовой разметки (OCR)
          • Аномалии метаданных (EXIF, PDF)

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;
    static final int EXIT_SUSPICIOUS = 2;

    private static final List<String> VISUALIZATION_KEYS = List.of("heatmap_path", "overlay_path");

    @Parameters(
        index = "0",
        description = "Путь к растровому изображению документа (PNG/JPEG/BMP/GIF)"
    )
    private Path imagePath;

    @Option(
        names = {"--id"},
        description = "Идентификатор документа (по умолчанию имя файла без расширения)"
    )
    private String documentId;

    @Option(
        names = {"--source"},
        description = "Исходный загруженный файл для анализа метаданных (например, PDF до растеризации)"
    )
    private Path sourcePath;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию из конфигурации)"
    )
    private Path outputDir;

    @Option(
        names = {"--json-only"},
        description = "Генерировать только JSON отчет"
    )
    private boolean jsonOnly = false;

    @Option(
        names = {"--visualize"},
        description = "Сохранить тепловую карту ELA и разметку текстовых областей OCR рядом с отчетами"
    )
    private boolean visualize = false;

    @Option(
        names = {"--fail-on-suspicious"},
        description = "Код выхода 2 при вердикте SUSPICIOUS или HIGHLY_SUSPICIOUS (для автоматизации)"
    )
    private boolean failOnSuspicious = false;

    private final Function<ForensicsConfig, ForensicPipeline> pipelineFactory;
    private final PrintStream out;

    public MainCommand() {
        this(ForensicPipeline::new, System.out);
    }

    MainCommand(Function<ForensicsConfig, ForensicPipeline> pipelineFactory, PrintStream out) {
        this.pipelineFactory = pipelineFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ForensicsConfig config = visualize
            ? ForensicsConfig.load(ForensicsConfig.DEFAULT_RESOURCE)
            : ForensicsConfig.load();
        String id = documentId != null && !documentId.isBlank() ? documentId : defaultId(imagePath);
        Path reportDir = outputDir != null ? outputDir : Paths.get(config.getReport().getOutputDir());
        if (visualize) {
            // отдельный экземпляр конфигурации: кэшированный общий не меняем
            config.getVisualization().setOutputDir(reportDir.toString());
        }

        log.info("Анализ документа {}: {}", id, imagePath);
        ForensicPipeline pipeline = pipelineFactory.apply(config);
        FusionResult result = pipeline.process(id, imagePath, sourcePath);

        try {
            Files.createDirectories(reportDir);

            ForensicReportFormatter formatter = new ForensicReportFormatter(config.getReport());
            new JsonReportGenerator(formatter).generate(result, reportDir.resolve("report_" + id + ".json"));
            if (!jsonOnly) {
                new PdfReportGenerator(formatter).generate(result, reportDir.resolve("report_" + id + ".pdf"));
            }
        } catch (IOException e) {
            log.error("Ошибка записи отчета: {}", e.getMessage(), e);
            return EXIT_IO_FAILURE;
        }

        printSummary(result);

        if (failOnSuspicious && result.getVerdict().isAlarming()) {
            log.error("Документ признан подозрительным (--fail-on-suspicious): {}", result.getVerdict());
            return EXIT_SUSPICIOUS;
        }
        return EXIT_OK;
    }

    private void printSummary(FusionResult result) {
        out.println("\n" + "=".repeat(80));
        out.println("DOCUMENT FORENSICS REPORT");
        out.println("=".repeat(80));
        out.println();
        out.println("Документ: " + result.getDocumentId());
        out.println("Вердикт: " + result.getVerdict() + " (" + result.getVerdict().getRussianName() + ")");
        out.println(String.format(Locale.ROOT, "Уверенность: %.2f%%   Неопределенность: %.2f%%",
            result.getOverallConfidence(), result.getUncertainty()));
        out.println(String.format(Locale.ROOT, "Время обработки: %.2f с", result.getProcessingTimeSeconds()));
        out.println();

        out.println("СИГНАЛЫ:");
        for (SignalName name : SignalName.values()) {
            SignalResult signal = result.getSignal(name);
            if (signal == null) {
                continue;
            }
            out.println(String.format(Locale.ROOT, "   %-22s %6.2f%%  [%s]  %s", name.getDisplayName(),
                signal.getOverallConfidence(), signal.getStatus().getValue(), signal.getSummary()));
        }
        out.println();

        printVisualizations(result);

        if (!result.getCombinedFindings().isEmpty()) {
            out.println("НАХОДКИ:");
            for (Finding finding : result.getCombinedFindings()) {
                out.println(String.format(Locale.ROOT, "   %6.2f%%  %-10s %s", finding.getConfidence(),
                    finding.getSource().getLabel(), finding.getDescription()));
            }
            out.println();
        }

        out.println("РЕКОМЕНДАЦИИ:");
        result.getRecommendations().forEach(r -> out.println("   - " + r));
        if (result.hasErrors()) {
            out.println();
            out.println("ОШИБКИ:");
            result.getErrors().forEach(e -> out.println("   - " + e));
        }
        out.println("=".repeat(80));
    }

    private void printVisualizations(FusionResult result) {
        StringBuilder lines = new StringBuilder();
        for (SignalName name : SignalName.values()) {
            SignalResult signal = result.getSignal(name);
            if (signal == null) {
                continue;
            }
            for (String key : VISUALIZATION_KEYS) {
                Object path = signal.getDetails().get(key);
                if (path != null) {
                    lines.append("   ").append(name.getLabel()).append(": ").append(path).append('\n');
                }
            }
        }
        if (lines.length() > 0) {
            out.println("ВИЗУАЛИЗАЦИИ:");
            out.print(lines);
            out.println();
        }
    }

    static String defaultId(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : "document";
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
