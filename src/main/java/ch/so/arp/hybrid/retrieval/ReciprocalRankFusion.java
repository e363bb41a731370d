package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion of several ranked lists:
 * {@code score(d) = sum over lists containing d of 1 / (k + rank(d))}.
 *
 * <p>Equal fused scores are ordered by first appearance, scanning the lists in
 * the given order and each list by rank. The first occurrence of a document
 * also supplies the payload carried into the fused result.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {
    }

    public static <T extends Ranked> List<Fused<T>> fuse(List<? extends List<? extends T>> lists) {
        return fuse(lists, DEFAULT_K);
    }

    public static <T extends Ranked> List<Fused<T>> fuse(List<? extends List<? extends T>> lists, int k) {
        Map<String, Accumulator<T>> accumulators = new LinkedHashMap<>();
        for (int listIndex = 0; listIndex < lists.size(); listIndex++) {
            List<? extends T> list = lists.get(listIndex);
            for (T item : list) {
                Accumulator<T> accumulator = accumulators.get(item.docId());
                if (accumulator == null) {
                    accumulator = new Accumulator<>(item, listIndex);
                    accumulators.put(item.docId(), accumulator);
                }
                accumulator.score += 1.0d / (k + item.rank());
            }
        }

        List<Accumulator<T>> ordered = new ArrayList<>(accumulators.values());
        ordered.sort(Comparator.comparingDouble((Accumulator<T> a) -> a.score).reversed()
                .thenComparingInt(a -> a.firstListIndex)
                .thenComparingInt(a -> a.first.rank()));

        List<Fused<T>> fused = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Accumulator<T> accumulator = ordered.get(i);
            fused.add(new Fused<>(accumulator.first, accumulator.score, i + 1));
        }
        return fused;
    }

    /**
     * Fused entry: the first occurrence of the document, its RRF score and its
     * one based rank in the fused list.
     */
    public record Fused<T extends Ranked>(T source, double score, int rank) implements Ranked {

        @Override
        public String docId() {
            return source.docId();
        }
    }

    private static final class Accumulator<T extends Ranked> {

        private final T first;
        private final int firstListIndex;
        private double score;

        private Accumulator(T first, int firstListIndex) {
            this.first = first;
            this.firstListIndex = firstListIndex;
        }
    }
}
