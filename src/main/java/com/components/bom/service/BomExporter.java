package com.components.bom.service;

import com.components.bom.model.Candidate;
import com.components.bom.model.ExportRow;
import com.components.bom.model.FieldKey;
import com.components.bom.model.LineItem;
import com.components.bom.service.core.PriceResolver;
import com.components.bom.session.BomSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the export rows of a session: one row per line item that has a selection, in line
 * item order. Items marked not available are exported with MPN {@code "NA"} and no catalog
 * data; unselected items are left out.
 */
@Slf4j
@Component
public class BomExporter {

    public List<ExportRow> export(final BomSession session) {
        List<ExportRow> rows = new ArrayList<>();
        for (LineItem item : session.lineItems()) {
            if (!item.hasSelection()) {
                continue;
            }
            if (item.isNotAvailable()) {
                rows.add(notAvailableRow(item));
                continue;
            }
            Optional<Candidate> part = session.selectedPart(item.getId());
            if (part.isEmpty()) {
                log.warn("Session {}: selection {} of item {} is not in its ranking; skipped",
                        session.getId(), item.getSelectedCandidateId(), item.getId());
                continue;
            }
            rows.add(selectedRow(item, part.get()));
        }
        log.info("Session {}: exported {} of {} line items", session.getId(), rows.size(), session.getItems().size());
        return rows;
    }

    private static ExportRow selectedRow(final LineItem item, final Candidate c) {
        return new ExportRow(
                item.refDesText(),
                item.getQuantity(),
                c.description() != null ? c.description() : item.description().orElse(null),
                c.packageCode() != null ? c.packageCode() : item.packageCode().orElse(null),
                c.partNumber(),
                c.candidateId(),
                c.manufacturer(),
                item.value().orElse(null),
                item.field(FieldKey.VOLTAGE).orElse(null),
                c.stockQuantity(),
                PriceResolver.priceAt(c, Math.max(1, item.getQuantity())),
                c.lifecycleStatus(),
                c.attribute(Candidate.ATTR_PRODUCT_URL));
    }

    private static ExportRow notAvailableRow(final LineItem item) {
        return new ExportRow(
                item.refDesText(),
                item.getQuantity(),
                item.description().orElse(null),
                item.packageCode().orElse(null),
                LineItem.NOT_AVAILABLE,
                null,
                null,
                item.value().orElse(null),
                item.field(FieldKey.VOLTAGE).orElse(null),
                null,
                null,
                null,
                null);
    }
}
