package com.purchasingpower.coderag.search;

import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reciprocal Rank Fusion Tests")
class ReciprocalRankFusionTest {

    private final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60, 1.0, 0.3);

    @Test
    @DisplayName("Should sum weighted reciprocal ranks across both lists")
    void testFuse_ShouldCombineLists() {
        List<SearchResult> vector = results(SearchSource.VECTOR, "a", "b", "c");
        List<SearchResult> lexical = results(SearchSource.LEXICAL, "c", "d");

        List<SearchResult> fused = fusion.fuse(vector, lexical, 10);

        assertEquals(List.of("c", "a", "b", "d"), ids(fused));
        assertEquals(1.0 / 63 + 0.3 / 61, fused.get(0).getScore(), 1e-12);
        assertEquals(0.3 / 62, fused.get(3).getScore(), 1e-12);
        fused.forEach(result -> assertEquals(SearchSource.HYBRID, result.getSource()));
    }

    @Test
    @DisplayName("Should truncate to topK with non-increasing scores")
    void testFuse_ShouldRespectTopK() {
        List<SearchResult> fused = fusion.fuse(
                results(SearchSource.VECTOR, "a", "b", "c", "d"),
                results(SearchSource.LEXICAL, "d", "e"), 2);

        assertEquals(2, fused.size());
        assertTrue(fused.get(0).getScore() >= fused.get(1).getScore());
    }

    @Test
    @DisplayName("Should break score ties by vector rank first")
    void testTies_ShouldPreferVectorRank() {
        ReciprocalRankFusion equalWeights = new ReciprocalRankFusion(60, 1.0, 1.0);

        List<SearchResult> fused = equalWeights.fuse(
                results(SearchSource.VECTOR, "x"), results(SearchSource.LEXICAL, "y"), 5);

        assertEquals(List.of("x", "y"), ids(fused));
        assertEquals(fused.get(0).getScore(), fused.get(1).getScore());
    }

    @Test
    @DisplayName("Should count a duplicated document once per list")
    void testDuplicates_ShouldCountOnce() {
        List<SearchResult> fused = fusion.fuse(results(SearchSource.VECTOR, "a", "a"), List.of(), 5);

        assertEquals(1, fused.size());
        assertEquals(1.0 / 61, fused.get(0).getScore(), 1e-12);
    }

    @Test
    @DisplayName("Should return an empty list when both inputs are empty")
    void testEmptyInputs_ShouldYieldNothing() {
        assertTrue(fusion.fuse(List.of(), List.of(), 3).isEmpty());
    }

    private static List<SearchResult> results(SearchSource source, String... ids) {
        return Arrays.stream(ids)
                .map(id -> SearchResult.of(Document.builder().id(id).content(id).metadata(Map.of()).build(),
                        1.0, source))
                .toList();
    }

    private static List<String> ids(List<SearchResult> results) {
        return results.stream().map(SearchResult::getDocumentId).toList();
    }
}
