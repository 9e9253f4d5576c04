package com.components.bom.service;

import com.components.bom.ai.KeywordService;
import com.components.bom.config.RankingProperties;
import com.components.bom.model.Candidate;
import com.components.bom.model.ExportRow;
import com.components.bom.model.LineItem;
import com.components.bom.model.RawRow;
import com.components.bom.model.ScoredCandidate;
import com.components.bom.parser.CandidateBatch;
import com.components.bom.parser.CandidateNormalizer;
import com.components.bom.parser.ColumnMapping;
import com.components.bom.parser.SchemaNormalizer;
import com.components.bom.service.core.ConsolidationResult;
import com.components.bom.service.core.LineItemConsolidator;
import com.components.bom.service.core.RankingEngine;
import com.components.bom.service.core.RankingOptions;
import com.components.bom.session.BomSession;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <h2>BOM session service</h2>
 *
 * <p>Entry point of the BOM workflow. Keeps the open {@link BomSession}s and drives each step:</p>
 * <ol>
 *   <li>{@link #open} normalizes the header and consolidates the rows into line items;</li>
 *   <li>{@link #rank} ranks candidates supplied by the caller, {@link #lookup} and
 *       {@link #lookupAll} fetch them from the catalog first; {@link #suggestKeyword} proposes
 *       the text for a user keyword lookup;</li>
 *   <li>{@link #select}, {@link #markNotAvailable} and {@link #clearSelection} record the user's
 *       choice;</li>
 *   <li>{@link #export} produces the output rows.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BomSessionService {

    private final SchemaNormalizer schemaNormalizer;
    private final CandidateNormalizer candidateNormalizer;
    private final LineItemConsolidator consolidator;
    private final RankingEngine rankingEngine;
    private final PartLookupService lookupService;
    private final KeywordService keywordService;
    private final BomExporter exporter;
    private final RankingProperties rankingProperties;

    private final Map<String, BomSession> sessions = new ConcurrentHashMap<>();

    /**
     * Opens a session for one BOM table.
     *
     * @param sourceName file or sheet name, informational only
     * @param header     header row
     * @param rows       body rows in file order
     * @return the new session
     * @throws com.components.bom.exception.BomSchemaException if the header is unusable
     */
    public BomSession open(final String sourceName, final List<String> header, final List<RawRow> rows) {
        ColumnMapping mapping = schemaNormalizer.normalize(header);
        ConsolidationResult result = consolidator.consolidate(mapping, rows);
        BomSession session = new BomSession(UUID.randomUUID().toString(), sourceName, mapping,
                result.lineItems(), result.issues());
        sessions.put(session.getId(), session);
        log.info("Opened session {} for '{}': {} line items, {} row issues",
                session.getId(), sourceName, result.lineItems().size(), result.issues().size());
        return session;
    }

    /**
     * @throws NoSuchElementException if no such session is open
     */
    public BomSession get(final String sessionId) {
        BomSession session = sessions.get(sessionId);
        if (session == null) {
            throw new NoSuchElementException("No BOM session " + sessionId);
        }
        return session;
    }

    public void close(final String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new NoSuchElementException("No BOM session " + sessionId);
        }
        log.info("Closed session {}", sessionId);
    }

    /**
     * Ranks candidates supplied by the caller and stores the ranking in the session.
     */
    public List<ScoredCandidate> rank(final String sessionId,
                                      final int itemId,
                                      final List<Candidate> candidates,
                                      final RankingOptions options) {
        BomSession session = get(sessionId);
        LineItem item = session.item(itemId);
        List<ScoredCandidate> ranked = rankingEngine.rank(item, candidates, effective(options));
        session.storeRanking(itemId, ranked);
        return ranked;
    }

    /**
     * Normalizes raw catalog records supplied by the caller, then ranks them like {@link #rank}.
     */
    public RankOutcome rankRecords(final String sessionId,
                                   final int itemId,
                                   final List<JsonNode> records,
                                   final RankingOptions options) {
        CandidateBatch batch = candidateNormalizer.normalizeAll(records);
        List<ScoredCandidate> ranked = rank(sessionId, itemId, batch.candidates(), options);
        return new RankOutcome(ranked, batch.rejected());
    }

    /**
     * Looks up one line item and stores its ranking.
     *
     * @param keyword user search text, {@code null} or blank for the MPN-then-keyword search
     */
    public LookupResult lookup(final String sessionId,
                               final int itemId,
                               final String keyword,
                               final RankingOptions options) {
        BomSession session = get(sessionId);
        LookupResult result = lookupService.lookup(session.item(itemId), keyword, effective(options));
        session.storeRanking(itemId, result.ranked());
        return result;
    }

    /**
     * Proposes a search keyword for a line item, for the user to edit before a keyword lookup.
     */
    public String suggestKeyword(final String sessionId, final int itemId) {
        return keywordService.suggestKeyword(get(sessionId).item(itemId));
    }

    /**
     * Looks up every line item of the session in parallel. Rankings are stored once all
     * lookups are done.
     */
    public List<LookupResult> lookupAll(final String sessionId, final RankingOptions options) {
        BomSession session = get(sessionId);
        List<LookupResult> results = lookupService.lookupAll(session.lineItems(), effective(options));
        results.forEach(r -> session.storeRanking(r.lineItemId(), r.ranked()));
        return results;
    }

    public void select(final String sessionId, final int itemId, final String candidateId) {
        get(sessionId).select(itemId, candidateId);
        log.info("Session {}: item {} → candidate {}", sessionId, itemId, candidateId);
    }

    public void markNotAvailable(final String sessionId, final int itemId) {
        get(sessionId).markNotAvailable(itemId);
        log.info("Session {}: item {} marked not available", sessionId, itemId);
    }

    public void clearSelection(final String sessionId, final int itemId) {
        get(sessionId).clearSelection(itemId);
    }

    public List<ExportRow> export(final String sessionId) {
        return exporter.export(get(sessionId));
    }

    private RankingOptions effective(final RankingOptions options) {
        return options != null ? options : rankingProperties.toOptions();
    }

    /**
     * Ranking of caller-supplied records.
     *
     * @param ranked   ranked candidates, best first
     * @param rejected records that could not be normalized
     */
    public record RankOutcome(List<ScoredCandidate> ranked, List<CandidateBatch.Rejected> rejected) {
    }
}
