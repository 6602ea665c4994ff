package com.purchasingpower.coderag.search;

import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted reciprocal rank fusion of a vector list and a lexical list.
 *
 * <p>A document at 1-based rank {@code r} in a list of weight {@code w} gets
 * {@code w / (k + r)}; contributions are summed across lists. Results are sorted
 * by fused score, then by vector rank, then by lexical rank.
 */
public class ReciprocalRankFusion {

    private final int k;
    private final double vectorWeight;
    private final double lexicalWeight;

    public ReciprocalRankFusion(int k, double vectorWeight, double lexicalWeight) {
        this.k = k;
        this.vectorWeight = vectorWeight;
        this.lexicalWeight = lexicalWeight;
    }

    public List<SearchResult> fuse(List<SearchResult> vector, List<SearchResult> lexical, int topK) {
        Map<String, Fused> fused = new LinkedHashMap<>();
        accumulate(fused, vector, vectorWeight, true);
        accumulate(fused, lexical, lexicalWeight, false);

        List<Fused> ranked = new ArrayList<>(fused.values());
        ranked.sort(Comparator.comparingDouble((Fused item) -> item.score).reversed()
                .thenComparingInt(item -> item.vectorRank)
                .thenComparingInt(item -> item.lexicalRank));

        List<SearchResult> results = new ArrayList<>(Math.min(topK, ranked.size()));
        for (Fused item : ranked) {
            if (results.size() >= topK) {
                break;
            }
            results.add(SearchResult.of(item.document, item.score, SearchSource.HYBRID));
        }
        return results;
    }

    private void accumulate(Map<String, Fused> fused, List<SearchResult> list, double weight, boolean vector) {
        for (int rank = 0; rank < list.size(); rank++) {
            Document document = list.get(rank).getDocument();
            Fused item = fused.computeIfAbsent(document.getId(), id -> new Fused(document));
            if (vector) {
                if (item.vectorRank != Integer.MAX_VALUE) {
                    continue;
                }
                item.vectorRank = rank;
            } else {
                if (item.lexicalRank != Integer.MAX_VALUE) {
                    continue;
                }
                item.lexicalRank = rank;
            }
            item.score += weight / (k + rank + 1);
        }
    }

    private static final class Fused {
        final Document document;
        double score;
        int vectorRank = Integer.MAX_VALUE;
        int lexicalRank = Integer.MAX_VALUE;

        Fused(Document document) {
            this.document = document;
        }
    }
}
