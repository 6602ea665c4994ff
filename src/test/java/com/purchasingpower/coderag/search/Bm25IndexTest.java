package com.purchasingpower.coderag.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BM25 Index Tests")
class Bm25IndexTest {

    private static final List<List<String>> CORPUS = List.of(
            List.of("parse", "config", "file"),
            List.of("load", "config"),
            List.of("render", "html", "page"));

    @Test
    @DisplayName("Should score only documents containing the query terms")
    void testScores_ShouldFavourMatchingDocuments() {
        Bm25Index index = Bm25Index.build(CORPUS);

        double[] scores = index.scores(List.of("parse"));

        assertEquals(3, scores.length);
        assertTrue(scores[0] > 0);
        assertEquals(0.0, scores[1]);
        assertEquals(0.0, scores[2]);
    }

    @Test
    @DisplayName("Should floor the idf of very common terms at a small positive value")
    void testCommonTerm_ShouldGetEpsilonFloor() {
        Bm25Index index = Bm25Index.build(CORPUS);

        // "config" is in 2 of 3 documents, so its raw idf would be negative
        double common = index.idf("config");
        double rare = index.idf("parse");

        assertTrue(common > 0, "common term must not contribute negatively");
        assertTrue(common < rare);
        assertEquals(Bm25Index.DEFAULT_EPSILON * meanOfRaw(), common, 1e-9);
    }

    @Test
    @DisplayName("Should count repeated query terms once per occurrence")
    void testRepeatedQueryTerm_ShouldAccumulate() {
        Bm25Index index = Bm25Index.build(CORPUS);

        double once = index.scores(List.of("render"))[2];
        double twice = index.scores(List.of("render", "render"))[2];

        assertEquals(2 * once, twice, 1e-9);
    }

    @Test
    @DisplayName("Should return zero scores for an empty corpus or unknown terms")
    void testEmptyCorpus_ShouldScoreNothing() {
        assertEquals(0, Bm25Index.build(List.of()).scores(List.of("anything")).length);
        assertArrayEquals(new double[]{0.0, 0.0, 0.0}, Bm25Index.build(CORPUS).scores(List.of("missing")));
    }

    @Test
    @DisplayName("Should restore identical scores after JSON serialization")
    void testJson_ShouldPreserveScores() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Bm25Index index = Bm25Index.build(CORPUS);

        Bm25Index restored = mapper.readValue(mapper.writeValueAsString(index), Bm25Index.class);

        assertEquals(index.size(), restored.size());
        assertArrayEquals(index.scores(List.of("config", "page")), restored.scores(List.of("config", "page")), 1e-12);
    }

    private static double meanOfRaw() {
        double rareIdf = Math.log(3 - 1 + 0.5) - Math.log(1 + 0.5);
        double commonIdf = Math.log(3 - 2 + 0.5) - Math.log(2 + 0.5);
        // six terms appear once, "config" appears twice
        return (6 * rareIdf + commonIdf) / 7;
    }
}
