package com.components.bom.session;

import com.components.bom.model.Candidate;
import com.components.bom.model.LineItem;
import com.components.bom.model.RowIssue;
import com.components.bom.model.ScoredCandidate;
import com.components.bom.parser.ColumnMapping;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <h2>BOM working session</h2>
 *
 * <p>One opened BOM file: its column mapping, its consolidated line items and, per line item,
 * the last ranking and the user's selection. Sessions are independent of each other; nothing
 * is shared between them.</p>
 *
 * <p>Line items are fixed when the session is opened. Rankings and selections may be updated
 * concurrently from different requests.</p>
 */
@Getter
public class BomSession {

    private final String id;
    private final String sourceName;
    private final Instant openedAt;
    private final ColumnMapping columns;
    private final List<RowIssue> rowIssues;

    /** Line items by id, in id order. */
    private final Map<Integer, LineItem> items;

    /** Last ranking per line item id. */
    private final Map<Integer, List<ScoredCandidate>> rankings = new ConcurrentHashMap<>();

    public BomSession(final String id,
                      final String sourceName,
                      final ColumnMapping columns,
                      final List<LineItem> lineItems,
                      final List<RowIssue> rowIssues) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceName = sourceName;
        this.openedAt = Instant.now();
        this.columns = Objects.requireNonNull(columns, "columns");
        this.rowIssues = List.copyOf(rowIssues);
        Map<Integer, LineItem> byId = new LinkedHashMap<>();
        lineItems.forEach(item -> byId.put(item.getId(), item));
        this.items = Collections.unmodifiableMap(byId);
    }

    public List<LineItem> lineItems() {
        return List.copyOf(items.values());
    }

    /**
     * @param itemId line item id
     * @return the line item
     * @throws NoSuchElementException if the session has no such item
     */
    public LineItem item(final int itemId) {
        LineItem item = items.get(itemId);
        if (item == null) {
            throw new NoSuchElementException("No line item " + itemId + " in session " + id);
        }
        return item;
    }

    /**
     * Stores a ranking for a line item, replacing the previous one. A selection that is no
     * longer among the ranked candidates is cleared.
     */
    public void storeRanking(final int itemId, final List<ScoredCandidate> ranked) {
        LineItem item = item(itemId);
        List<ScoredCandidate> copy = List.copyOf(ranked);
        rankings.put(itemId, copy);
        String selected = item.getSelectedCandidateId();
        if (selected != null && !item.isNotAvailable()
                && copy.stream().noneMatch(sc -> sc.candidateId().equals(selected))) {
            item.setSelectedCandidateId(null);
        }
    }

    public List<ScoredCandidate> ranking(final int itemId) {
        item(itemId);
        return rankings.getOrDefault(itemId, List.of());
    }

    /**
     * Selects a candidate from the item's stored ranking. Selecting again replaces the choice.
     *
     * @throws NoSuchElementException   if the item does not exist
     * @throws IllegalArgumentException if the candidate is not in the item's ranking
     */
    public void select(final int itemId, final String candidateId) {
        LineItem item = item(itemId);
        boolean ranked = ranking(itemId).stream().anyMatch(sc -> sc.candidateId().equals(candidateId));
        if (!ranked) {
            throw new IllegalArgumentException(
                    "Candidate " + candidateId + " was not ranked for line item " + itemId);
        }
        item.setSelectedCandidateId(candidateId);
    }

    public void markNotAvailable(final int itemId) {
        item(itemId).setSelectedCandidateId(LineItem.NOT_AVAILABLE);
    }

    public void clearSelection(final int itemId) {
        item(itemId).setSelectedCandidateId(null);
    }

    /**
     * The scored candidate the user picked, if any. Empty for unselected and NA items.
     */
    public Optional<ScoredCandidate> selectedCandidate(final int itemId) {
        LineItem item = item(itemId);
        String selected = item.getSelectedCandidateId();
        if (selected == null || item.isNotAvailable()) {
            return Optional.empty();
        }
        return ranking(itemId).stream()
                .filter(sc -> sc.candidateId().equals(selected))
                .findFirst();
    }

    public Optional<Candidate> selectedPart(final int itemId) {
        return selectedCandidate(itemId).map(ScoredCandidate::candidate);
    }
}
