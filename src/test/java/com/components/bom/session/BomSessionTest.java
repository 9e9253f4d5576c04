package com.components.bom.session;

import com.components.bom.model.Candidate;
import com.components.bom.model.FieldKey;
import com.components.bom.model.LifecycleStatus;
import com.components.bom.model.LineItem;
import com.components.bom.model.ScoreBreakdown;
import com.components.bom.model.ScoredCandidate;
import com.components.bom.parser.ColumnMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BomSessionTest {

    private BomSession session;

    @BeforeEach
    void setUp() {
        ColumnMapping columns = new ColumnMapping(List.of("MPN"), List.of(FieldKey.MPN), Set.of());
        session = new BomSession("s1", "test.csv", columns, List.of(
                new LineItem(1, Map.of(FieldKey.MPN, "RC0603FR-071KL"), List.of("R1", "R2"), 2, List.of()),
                new LineItem(2, Map.of(FieldKey.MPN, "LM358"), List.of("U1"), 1, List.of())), List.of());
        session.storeRanking(1, List.of(scored("603-A"), scored("603-B")));
    }

    @Test
    void selectsOnlyRankedCandidates() {
        session.select(1, "603-B");
        assertThat(session.selectedPart(1)).map(Candidate::candidateId).contains("603-B");

        session.select(1, "603-A");
        assertThat(session.item(1).getSelectedCandidateId()).isEqualTo("603-A");

        assertThatThrownBy(() -> session.select(1, "unknown"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.select(2, "603-A"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void notAvailableAndClearSelection() {
        session.markNotAvailable(2);
        assertThat(session.item(2).isNotAvailable()).isTrue();
        assertThat(session.selectedCandidate(2)).isEmpty();

        session.clearSelection(2);
        assertThat(session.item(2).hasSelection()).isFalse();
    }

    @Test
    void newRankingWithoutSelectedCandidateClearsSelection() {
        session.select(1, "603-A");
        session.storeRanking(1, List.of(scored("603-B")));

        assertThat(session.item(1).hasSelection()).isFalse();
        assertThat(session.ranking(1)).hasSize(1);
    }

    @Test
    void unknownItemIsNotFound() {
        assertThatThrownBy(() -> session.item(99)).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> session.markNotAvailable(99)).isInstanceOf(NoSuchElementException.class);
        assertThat(session.ranking(2)).isEmpty();
    }

    private static ScoredCandidate scored(final String id) {
        Candidate c = new Candidate(id, "RC0603FR-071KL", "YAGEO", null, "0603", new BigDecimal("0.10"),
                List.of(), 100, LifecycleStatus.ACTIVE, Map.of());
        return new ScoredCandidate(c, 1.0, new ScoreBreakdown(1, 1, 1, 1, new BigDecimal("0.10"), 2));
    }
}
