package com.ethixai.drift.service;

import com.ethixai.drift.dto.BaselineDocument;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Read-through cache of decoded baselines, one per {@link BaselineService}. Entries are replaced whole,
 * never mutated.
 */
public class BaselineCache {

    private final ConcurrentHashMap<String, BaselineDocument> entries = new ConcurrentHashMap<>();

    public BaselineDocument get(String modelId, Function<String, BaselineDocument> loader) {
        BaselineDocument cached = entries.get(modelId);
        if (cached != null) {
            return cached;
        }
        BaselineDocument loaded = loader.apply(modelId);
        // a replacement swapped in while loading wins over the value just read
        BaselineDocument existing = entries.putIfAbsent(modelId, loaded);
        return existing != null ? existing : loaded;
    }

    public Optional<BaselineDocument> peek(String modelId) {
        return Optional.ofNullable(entries.get(modelId));
    }

    public void swap(BaselineDocument document) {
        entries.put(document.getModelId(), document);
    }

    public void invalidate(String modelId) {
        entries.remove(modelId);
    }

    public int size() {
        return entries.size();
    }
}
