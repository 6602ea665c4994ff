package com.purchasingpower.coderag.support;

import com.purchasingpower.coderag.knowledge.EmbeddingGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embeddings for tests: every token is hashed into one
 * of {@code dimension} buckets, so texts sharing words have similar vectors.
 */
public class FakeEmbeddingGateway implements EmbeddingGateway {

    public static final int DIMENSION = 8;

    private final AtomicInteger calls = new AtomicInteger();

    private volatile boolean unavailable;
    private volatile boolean throwing;
    private volatile String unembeddableMarker;
    private volatile Runnable beforeEmbed;

    @Override
    public float[] embedText(String text) {
        calls.incrementAndGet();
        Runnable hook = beforeEmbed;
        if (hook != null) {
            hook.run();
        }
        if (throwing) {
            throw new IllegalStateException("embedding backend down");
        }
        if (unavailable || text == null || text.isBlank()) {
            return new float[0];
        }
        if (unembeddableMarker != null && text.contains(unembeddableMarker)) {
            return new float[0];
        }
        return vectorOf(text);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedText(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }

    public static float[] vectorOf(String text) {
        float[] vector = new float[DIMENSION];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), DIMENSION)] += 1f;
            }
        }
        return vector;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setThrowing(boolean throwing) {
        this.throwing = throwing;
    }

    /**
     * Texts containing the marker get an empty vector, as if their batch failed.
     */
    public void setUnembeddableMarker(String marker) {
        this.unembeddableMarker = marker;
    }

    /**
     * Runs before every embedding, on the calling thread.
     */
    public void setBeforeEmbed(Runnable hook) {
        this.beforeEmbed = hook;
    }

    public int getCalls() {
        return calls.get();
    }
}
