package com.docforensics.heuristics;

import com.docforensics.models.Finding;
import com.docforensics.models.SignalName;
import com.docforensics.models.SignalResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Объединение находок всех сигналов в один список
 */
public class FindingAggregator {

    private final int maxFindings;

    public FindingAggregator(int maxFindings) {
        this.maxFindings = maxFindings;
    }

    /**
     * Находки ELA, OCR, Metadata подряд, затем устойчивая сортировка по убыванию уверенности.
     * Равные по уверенности сохраняют порядок сигналов.
     */
    public List<Finding> combine(Map<SignalName, SignalResult> perSignal) {
        List<Finding> combined = new ArrayList<>();
        for (SignalName name : SignalName.values()) {
            SignalResult result = perSignal.get(name);
            if (result != null && result.isCompleted()) {
                combined.addAll(result.getFindings());
            }
        }
        combined.sort(Comparator.comparingDouble(Finding::getConfidence).reversed());
        if (combined.size() > maxFindings) {
            return List.copyOf(combined.subList(0, maxFindings));
        }
        return List.copyOf(combined);
    }
}
