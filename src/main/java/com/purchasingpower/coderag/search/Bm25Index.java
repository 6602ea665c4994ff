package com.purchasingpower.coderag.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Okapi BM25 over a fixed corpus. Immutable: adding documents means building a new index.
 *
 * <p>Inverse document frequency is {@code ln(N - n + 0.5) - ln(n + 0.5)}. Terms that
 * appear in more than half the corpus would get a negative idf; they get
 * {@code epsilon * mean(idf)} instead. Only the per-document term frequencies and
 * the parameters are serialized; everything else is derived on construction.
 */
public final class Bm25Index {

    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B = 0.75;
    public static final double DEFAULT_EPSILON = 0.25;

    private final double k1;
    private final double b;
    private final double epsilon;
    private final List<Map<String, Integer>> termFrequencies;

    private final int[] documentLengths;
    private final double averageLength;
    private final Map<String, Double> idf;

    @JsonCreator
    public Bm25Index(@JsonProperty("k1") double k1,
                     @JsonProperty("b") double b,
                     @JsonProperty("epsilon") double epsilon,
                     @JsonProperty("termFrequencies") List<Map<String, Integer>> termFrequencies) {
        this.k1 = k1;
        this.b = b;
        this.epsilon = epsilon;
        this.termFrequencies = termFrequencies == null ? List.of() : List.copyOf(termFrequencies);

        int corpusSize = this.termFrequencies.size();
        this.documentLengths = new int[corpusSize];
        Map<String, Integer> documentFrequency = new HashMap<>();
        long totalLength = 0;
        for (int i = 0; i < corpusSize; i++) {
            int length = 0;
            for (Map.Entry<String, Integer> entry : this.termFrequencies.get(i).entrySet()) {
                length += entry.getValue();
                documentFrequency.merge(entry.getKey(), 1, Integer::sum);
            }
            documentLengths[i] = length;
            totalLength += length;
        }
        this.averageLength = corpusSize == 0 ? 0.0 : (double) totalLength / corpusSize;
        this.idf = computeIdf(documentFrequency, corpusSize, epsilon);
    }

    public static Bm25Index build(List<List<String>> tokenizedDocuments) {
        return build(tokenizedDocuments, DEFAULT_K1, DEFAULT_B, DEFAULT_EPSILON);
    }

    public static Bm25Index build(List<List<String>> tokenizedDocuments, double k1, double b, double epsilon) {
        List<Map<String, Integer>> frequencies = new ArrayList<>(tokenizedDocuments.size());
        for (List<String> tokens : tokenizedDocuments) {
            Map<String, Integer> counts = new HashMap<>();
            for (String token : tokens) {
                counts.merge(token, 1, Integer::sum);
            }
            frequencies.add(counts);
        }
        return new Bm25Index(k1, b, epsilon, frequencies);
    }

    private static Map<String, Double> computeIdf(Map<String, Integer> documentFrequency, int corpusSize,
                                                  double epsilon) {
        Map<String, Double> idf = new HashMap<>();
        List<String> negative = new ArrayList<>();
        double sum = 0.0;
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            int frequency = entry.getValue();
            double value = Math.log(corpusSize - frequency + 0.5) - Math.log(frequency + 0.5);
            idf.put(entry.getKey(), value);
            sum += value;
            if (value < 0) {
                negative.add(entry.getKey());
            }
        }
        if (!idf.isEmpty()) {
            double floor = epsilon * (sum / idf.size());
            for (String term : negative) {
                idf.put(term, floor);
            }
        }
        return idf;
    }

    /**
     * Score of every document for the query, indexed like the corpus. A repeated
     * query term counts once per occurrence.
     */
    public double[] scores(List<String> queryTokens) {
        int corpusSize = termFrequencies.size();
        double[] scores = new double[corpusSize];
        if (corpusSize == 0 || averageLength == 0.0) {
            return scores;
        }
        for (String term : queryTokens) {
            Double termIdf = idf.get(term);
            if (termIdf == null) {
                continue;
            }
            for (int i = 0; i < corpusSize; i++) {
                Integer frequency = termFrequencies.get(i).get(term);
                if (frequency == null) {
                    continue;
                }
                double normalizer = k1 * (1 - b + b * documentLengths[i] / averageLength);
                scores[i] += termIdf * (frequency * (k1 + 1) / (frequency + normalizer));
            }
        }
        return scores;
    }

    @JsonProperty("k1")
    public double getK1() {
        return k1;
    }

    @JsonProperty("b")
    public double getB() {
        return b;
    }

    @JsonProperty("epsilon")
    public double getEpsilon() {
        return epsilon;
    }

    @JsonProperty("termFrequencies")
    public List<Map<String, Integer>> getTermFrequencies() {
        return termFrequencies;
    }

    @JsonIgnore
    public int size() {
        return termFrequencies.size();
    }

    @JsonIgnore
    public double idf(String term) {
        return idf.getOrDefault(term, 0.0);
    }

    @JsonIgnore
    public Map<String, Double> getIdf() {
        return Collections.unmodifiableMap(idf);
    }
}
