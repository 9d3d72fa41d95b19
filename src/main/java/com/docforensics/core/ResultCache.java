package com.docforensics.core;

import com.docforensics.models.FusionResult;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Кэш результатов по идентификатору документа.
 * Не более одного вычисления на идентификатор: параллельные вызовы ждут уже идущее.
 */
@Slf4j
public class ResultCache {

    private final AsyncCache<String, FusionResult> cache = Caffeine.newBuilder().buildAsync();

    /**
     * Вернуть результат из кэша или вычислить его в текущем потоке.
     * Ошибка вычисления не кэшируется; ожидающие его вызовы повторяют попытку сами.
     */
    public FusionResult getOrCompute(String documentId, Function<String, FusionResult> computation) {
        while (true) {
            CompletableFuture<FusionResult> mine = new CompletableFuture<>();
            CompletableFuture<FusionResult> existing = cache.asMap().putIfAbsent(documentId, mine);
            if (existing == null) {
                return compute(documentId, mine, computation);
            }
            log.debug("Документ {} уже в кэше или обрабатывается, ожидаем результат", documentId);
            try {
                return existing.join();
            } catch (CompletionException | CancellationException e) {
                // запись неудачного вычисления уже удалена
                log.debug("Вычисление документа {} в другом потоке не завершилось, повторяем", documentId);
            }
        }
    }

    private FusionResult compute(String documentId, CompletableFuture<FusionResult> mine,
                                 Function<String, FusionResult> computation) {
        try {
            FusionResult result = computation.apply(documentId);
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(documentId, mine);
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Готовый результат или null (нет записи либо вычисление еще идет)
     */
    public FusionResult getIfPresent(String documentId) {
        CompletableFuture<FusionResult> future = cache.getIfPresent(documentId);
        return isReady(future) ? future.join() : null;
    }

    /**
     * Число готовых записей
     */
    public int size() {
        return completedResults().size();
    }

    /**
     * Снимок готовых результатов
     */
    public List<FusionResult> completedResults() {
        List<FusionResult> results = new ArrayList<>();
        for (CompletableFuture<FusionResult> future : cache.asMap().values()) {
            if (isReady(future)) {
                results.add(future.join());
            }
        }
        return results;
    }

    /**
     * Удалить готовые записи. Идущие вычисления остаются в кэше,
     * чтобы повторный запрос того же документа присоединился к ним, а не запустил второе.
     *
     * @return число оставленных вычислений
     */
    public int clear() {
        int inFlight = 0;
        for (var entry : cache.asMap().entrySet()) {
            if (entry.getValue().isDone()) {
                cache.asMap().remove(entry.getKey(), entry.getValue());
            } else {
                inFlight++;
            }
        }
        return inFlight;
    }

    private static boolean isReady(CompletableFuture<FusionResult> future) {
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }
}
