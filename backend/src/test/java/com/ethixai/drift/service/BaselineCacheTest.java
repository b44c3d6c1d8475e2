package com.ethixai.drift.service;

import com.ethixai.drift.dto.BaselineDocument;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineCacheTest {

    @Test
    void loaderRunsOncePerModel() {
        BaselineCache cache = new BaselineCache();
        AtomicInteger loads = new AtomicInteger();

        BaselineDocument first = cache.get("fraud-v7", id -> {
            loads.incrementAndGet();
            return document(id, 100);
        });
        BaselineDocument second = cache.get("fraud-v7", id -> {
            loads.incrementAndGet();
            return document(id, 200);
        });

        assertThat(second).isSameAs(first);
        assertThat(loads).hasValue(1);
    }

    @Test
    void swapReplacesWholeDocument() {
        BaselineCache cache = new BaselineCache();
        BaselineDocument original = cache.get("fraud-v7", id -> document(id, 100));
        BaselineDocument replacement = document("fraud-v7", 300);

        cache.swap(replacement);

        assertThat(cache.peek("fraud-v7")).containsSame(replacement);
        assertThat(original.getSampleCount()).isEqualTo(100);
    }

    @Test
    void swapDuringLoadWins() {
        BaselineCache cache = new BaselineCache();
        BaselineDocument replacement = document("fraud-v7", 300);

        BaselineDocument result = cache.get("fraud-v7", id -> {
            cache.swap(replacement);
            return document(id, 100);
        });

        assertThat(result).isSameAs(replacement);
    }

    @Test
    void invalidateForcesReload() {
        BaselineCache cache = new BaselineCache();
        cache.get("fraud-v7", id -> document(id, 100));

        cache.invalidate("fraud-v7");

        assertThat(cache.peek("fraud-v7")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    private static BaselineDocument document(String modelId, int samples) {
        return BaselineDocument.builder().modelId(modelId).sampleCount(samples).build();
    }
}
