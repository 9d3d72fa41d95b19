package com.docforensics.analyzers;

import com.docforensics.config.ForensicsConfig;
import com.docforensics.heuristics.ConfidenceCalculator;
import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.ocr.OcrWord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Правила несогласованности текстовой разметки: кегль в строке, выравнивание,
 * интервалы между блоками, смешанный регистр.
 */
class LayoutInconsistencyDetector {

    static final String FONT_SIZE = "font_size_inconsistency";
    static final String ALIGNMENT = "alignment_inconsistency";
    static final String SPACING = "abnormal_spacing";
    static final String MIXED_FORMATTING = "mixed_formatting";

    private final ForensicsConfig.Layout settings;

    LayoutInconsistencyDetector(ForensicsConfig.Layout settings) {
        this.settings = settings;
    }

    /**
     * Отбросить пустой текст, низкую уверенность OCR и слишком маленькие рамки.
     * Порядок входа сохраняется.
     */
    List<TextRegion> filter(List<OcrWord> words) {
        List<TextRegion> regions = new ArrayList<>();
        if (words == null) {
            return regions;
        }
        for (OcrWord word : words) {
            if (word == null || word.getText() == null || word.getText().isBlank()) {
                continue;
            }
            if (word.getConfidence() < settings.getMinOcrConfidence()) {
                continue;
            }
            if (word.getBbox().getWidth() < settings.getMinRegionSize()
                || word.getBbox().getHeight() < settings.getMinRegionSize()) {
                continue;
            }
            regions.add(TextRegion.of(word));
        }
        return regions;
    }

    /**
     * Группировка в строки за один проход по y: область в пределах допуска от якоря
     * текущей строки попадает в нее, иначе начинает новую строку.
     */
    List<List<TextRegion>> groupIntoLines(List<TextRegion> regions) {
        List<TextRegion> sorted = new ArrayList<>(regions);
        sorted.sort(Comparator.comparingInt(r -> r.getBbox().getY()));

        List<List<TextRegion>> lines = new ArrayList<>();
        List<TextRegion> current = null;
        int anchorY = 0;
        for (TextRegion region : sorted) {
            int y = region.getBbox().getY();
            if (current == null || Math.abs(y - anchorY) > settings.getLineTolerancePx()) {
                current = new ArrayList<>();
                lines.add(current);
                anchorY = y;
            }
            current.add(region);
        }
        return lines;
    }

    List<Finding> detect(List<TextRegion> regions) {
        List<Finding> findings = new ArrayList<>();
        if (regions.size() < 2) {
            return findings;
        }
        checkFontSizes(groupIntoLines(regions), findings);
        checkAlignment(regions, findings);
        checkSpacing(regions, findings);
        checkMixedFormatting(regions, findings);
        return findings;
    }

    private void checkFontSizes(List<List<TextRegion>> lines, List<Finding> findings) {
        for (int lineNo = 0; lineNo < lines.size(); lineNo++) {
            List<TextRegion> line = lines.get(lineNo);
            if (line.size() < 2) {
                continue;
            }
            double mean = line.stream().mapToInt(TextRegion::getFontSizeEstimate).average().orElse(0);
            double variance = line.stream()
                .mapToDouble(r -> Math.pow(r.getFontSizeEstimate() - mean, 2))
                .average().orElse(0);
            double std = Math.sqrt(variance);

            // Строго больше: ровно 20% от среднего не считается аномалией
            if (std > mean * settings.getFontSizeVariationRatio()) {
                Finding.FindingBuilder builder = Finding.builder()
                    .kind(FONT_SIZE)
                    .source(SignalName.OCR)
                    .confidence(ConfidenceCalculator.round2(Math.min(90, std * 2)))
                    .description("Font size varies significantly within line " + lineNo)
                    .bbox(line.get(0).getBbox())
                    .detail("line", lineNo)
                    .detail("mean_font_size", ConfidenceCalculator.round2(mean))
                    .detail("std_deviation", ConfidenceCalculator.round2(std))
                    .detail("variation_percentage", ConfidenceCalculator.round2(std / mean * 100));
                builder.detail("regions", line.stream().map(r -> r.getBbox().toList()).toList());
                findings.add(builder.build());
            }
        }
    }

    private void checkAlignment(List<TextRegion> regions, List<Finding> findings) {
        for (int i = 0; i < regions.size() - 1; i++) {
            for (int j = i + 1; j < regions.size(); j++) {
                TextRegion first = regions.get(i);
                TextRegion second = regions.get(j);
                int minHeight = Math.min(first.getBbox().getHeight(), second.getBbox().getHeight());
                int overlap = first.getBbox().verticalOverlap(second.getBbox());
                if (overlap <= minHeight * 0.5 || first.getLineId() != second.getLineId()) {
                    continue;
                }
                int difference = Math.abs(first.getBbox().getX() - second.getBbox().getX());
                if (difference > settings.getAlignmentTolerancePx()) {
                    findings.add(Finding.builder()
                        .kind(ALIGNMENT)
                        .source(SignalName.OCR)
                        .confidence(65)
                        .description("Text blocks on same line have different alignments")
                        .bbox(first.getBbox())
                        .detail("block1_text", first.preview(20))
                        .detail("block2_text", second.preview(20))
                        .detail("x_positions", List.of(first.getBbox().getX(), second.getBbox().getX()))
                        .detail("difference", difference)
                        .build());
                }
            }
        }
    }

    private void checkSpacing(List<TextRegion> regions, List<Finding> findings) {
        for (int i = 0; i < regions.size() - 1; i++) {
            TextRegion first = regions.get(i);
            TextRegion second = regions.get(i + 1);
            int gap = second.getBbox().getX() - first.getBbox().getRight();
            if (gap > settings.getSpacingGapPx()) {
                findings.add(Finding.builder()
                    .kind(SPACING)
                    .source(SignalName.OCR)
                    .confidence(ConfidenceCalculator.round2(Math.min(80, gap / 10.0)))
                    .description("Abnormally large gap between text blocks")
                    .bbox(first.getBbox())
                    .detail("gap_pixels", gap)
                    .detail("block1_text", first.preview(20))
                    .detail("block2_text", second.preview(20))
                    .build());
            }
        }
    }

    private void checkMixedFormatting(List<TextRegion> regions, List<Finding> findings) {
        for (TextRegion region : regions) {
            if (isMixedFormatting(region.getText())) {
                findings.add(Finding.builder()
                    .kind(MIXED_FORMATTING)
                    .source(SignalName.OCR)
                    .confidence(70)
                    .description("Mixed character formatting in text: '" + region.preview(30) + "'")
                    .bbox(region.getBbox())
                    .detail("text", region.getText())
                    .detail("length", region.getText().length())
                    .build());
            }
        }
    }

    static boolean isMixedFormatting(String text) {
        if (text.length() <= 3 || text.length() >= 10) {
            return false;
        }
        boolean hasLower = text.chars().anyMatch(Character::isLowerCase);
        boolean hasUpper = text.chars().anyMatch(Character::isUpperCase);
        boolean allUpper = hasUpper && !hasLower;
        return hasLower && hasUpper && !Character.isUpperCase(text.charAt(0)) && !allUpper;
    }

    /**
     * Уверенность сигнала: при находках - смесь количества и средней серьезности,
     * без находок - убывает с числом распознанных областей.
     */
    static double calculateConfidence(List<Finding> findings, int regionCount) {
        if (regionCount == 0) {
            return 0.0;
        }
        double score;
        if (!findings.isEmpty()) {
            double countScore = Math.min(100, findings.size() * 20);
            double avgSeverity = findings.stream().mapToDouble(Finding::getConfidence).average().orElse(0);
            score = countScore * 0.4 + avgSeverity * 0.6;
        } else {
            score = Math.max(0, 100 - regionCount * 2);
        }
        return ConfidenceCalculator.round2(ConfidenceCalculator.clamp(score));
    }

    static String summarize(List<Finding> findings, double overall) {
        if (findings.isEmpty()) {
            if (overall < 30) {
                return "No text inconsistencies detected. Document formatting appears consistent.";
            }
            return "Minor text anomalies detected. Document likely authentic.";
        }
        int total = findings.size();
        if (total >= 3) {
            return "Multiple text inconsistencies detected (" + total
                + " issues). Document shows signs of text editing or manipulation.";
        }
        if (total == 2) {
            return "Two text inconsistencies detected. Document may have been altered.";
        }
        String kind = findings.get(0).getKind();
        if (kind.contains("font")) {
            return "Font inconsistency detected. Text appears to have been edited.";
        }
        if (kind.contains("alignment")) {
            return "Alignment inconsistency detected. Document formatting appears inconsistent.";
        }
        return "Text inconsistency detected. Further verification recommended.";
    }
}
