package ch.so.arp.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

    @Test
    void breaksEqualScoresByFirstListAndRank() {
        List<RankedItem> dense = List.of(new RankedItem("d1", 0.9d, 1), new RankedItem("d2", 0.8d, 2));
        List<RankedItem> sparse = List.of(new RankedItem("d2", 7.0d, 1), new RankedItem("d1", 3.0d, 2));

        List<ReciprocalRankFusion.Fused<RankedItem>> fused = ReciprocalRankFusion.fuse(List.of(dense, sparse), 60);

        assertThat(fused).extracting(ReciprocalRankFusion.Fused::docId).containsExactly("d1", "d2");
        assertThat(fused.get(0).score()).isCloseTo(1.0d / 61 + 1.0d / 62, within(1e-12));
        assertThat(fused.get(1).score()).isEqualTo(fused.get(0).score());
    }

    @Test
    void documentsMissingFromAListContributeNothing() {
        List<RankedItem> dense = List.of(new RankedItem("a", 0.9d, 1), new RankedItem("b", 0.5d, 2));
        List<RankedItem> sparse = List.of(new RankedItem("c", 4.0d, 1), new RankedItem("b", 2.0d, 2));

        List<ReciprocalRankFusion.Fused<RankedItem>> fused = ReciprocalRankFusion.fuse(List.of(dense, sparse));

        assertThat(fused).extracting(ReciprocalRankFusion.Fused::docId).containsExactly("b", "a", "c");
        assertThat(fused.get(0).score()).isCloseTo(2.0d / 62, within(1e-12));
        assertThat(fused.get(1).score()).isCloseTo(1.0d / 61, within(1e-12));
        assertThat(fused.get(2).score()).isCloseTo(1.0d / 61, within(1e-12));
    }

    @Test
    void assignsContiguousRanks() {
        List<RankedItem> only = List.of(new RankedItem("x", 1.0d, 1), new RankedItem("y", 0.5d, 2),
                new RankedItem("z", 0.1d, 3));

        List<ReciprocalRankFusion.Fused<RankedItem>> fused = ReciprocalRankFusion
                .fuse(List.of(only, List.<RankedItem>of()));

        assertThat(fused).extracting(ReciprocalRankFusion.Fused::rank).containsExactly(1, 2, 3);
        assertThat(fused).extracting(ReciprocalRankFusion.Fused::docId).containsExactly("x", "y", "z");
    }

    @Test
    void keepsPayloadOfFirstOccurrence() {
        RankedItem fromDense = new RankedItem("d1", 0.42d, 3);
        RankedItem fromSparse = new RankedItem("d1", 9.5d, 1);

        List<ReciprocalRankFusion.Fused<RankedItem>> fused = ReciprocalRankFusion
                .fuse(List.of(List.of(fromDense), List.of(fromSparse)));

        assertThat(fused).hasSize(1);
        assertThat(fused.get(0).source()).isSameAs(fromDense);
    }

    @Test
    void honoursCustomSmoothingConstant() {
        List<RankedItem> list = List.of(new RankedItem("d1", 1.0d, 1));

        assertThat(ReciprocalRankFusion.fuse(List.of(list), 0).get(0).score()).isEqualTo(1.0d);
        assertThat(ReciprocalRankFusion.fuse(List.of(list), 9).get(0).score()).isCloseTo(0.1d, within(1e-12));
    }

    @Test
    void emptyInputFusesToEmptyList() {
        assertThat(ReciprocalRankFusion.fuse(List.<List<RankedItem>>of())).isEmpty();
        assertThat(ReciprocalRankFusion.fuse(List.of(List.<RankedItem>of(), List.<RankedItem>of()))).isEmpty();
    }
}
