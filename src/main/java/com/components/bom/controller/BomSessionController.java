package com.components.bom.controller;

import com.components.bom.config.RankingProperties;
import com.components.bom.dto.BomUploadRequest;
import com.components.bom.dto.LineItemView;
import com.components.bom.dto.LookupRequest;
import com.components.bom.dto.RankRequest;
import com.components.bom.dto.RankResponse;
import com.components.bom.dto.SelectionRequest;
import com.components.bom.dto.SessionResponse;
import com.components.bom.model.ExportRow;
import com.components.bom.model.ScoredCandidate;
import com.components.bom.service.BomSessionService;
import com.components.bom.service.core.RankingOptions;
import com.components.bom.session.BomSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the BOM workflow: open a BOM, rank or look up candidates per line item,
 * record selections and export the result.
 * <p>
 * Base path: <code>/api/bom/sessions</code><br>
 * Consumes and produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/bom/sessions
 * Content-Type: application/json
 *
 * {
 *   "sourceName": "power-board.xlsx",
 *   "header": ["Designator", "Manufacturer Part Number", "Qty"],
 *   "rows": [ ["R1", "RC0603FR-071KL", 1], ["R2", "RC0603FR-071KL", 1] ]
 * }
 * }</pre>
 */
@RestController
@RequestMapping(value = "/api/bom/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class BomSessionController {

    private final BomSessionService sessionService;
    private final RankingProperties rankingProperties;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse open(@RequestBody @Validated final BomUploadRequest request) {
        BomSession session = sessionService.open(request.sourceName(), request.header(), request.toRawRows());
        return SessionResponse.from(session);
    }

    @GetMapping("/{sessionId}")
    public SessionResponse get(@PathVariable final String sessionId) {
        return SessionResponse.from(sessionService.get(sessionId));
    }

    @GetMapping("/{sessionId}/items")
    public List<LineItemView> items(@PathVariable final String sessionId) {
        return sessionService.get(sessionId).lineItems().stream()
                .map(LineItemView::from)
                .toList();
    }

    /**
     * Ranks catalog records supplied by the client.
     */
    @PostMapping(value = "/{sessionId}/items/{itemId}/rank", consumes = MediaType.APPLICATION_JSON_VALUE)
    public RankResponse rank(@PathVariable final String sessionId,
                             @PathVariable final int itemId,
                             @RequestBody @Validated final RankRequest request) {
        RankingOptions options = rankingProperties.toOptions(
                request.allowObsolete(), request.excludeZeroStock(), request.maxResults());
        BomSessionService.RankOutcome outcome =
                sessionService.rankRecords(sessionId, itemId, request.candidates(), options);
        return new RankResponse(itemId, null, null, outcome.ranked(), outcome.rejected());
    }

    /**
     * Searches the catalog for one line item and ranks the result. A {@code keyword} in the body
     * replaces the MPN and generated keyword searches.
     */
    @PostMapping("/{sessionId}/items/{itemId}/lookup")
    public RankResponse lookup(@PathVariable final String sessionId,
                               @PathVariable final int itemId,
                               @RequestBody(required = false) @Validated final LookupRequest request) {
        String keyword = request == null ? null : request.keyword();
        return RankResponse.from(sessionService.lookup(sessionId, itemId, keyword, options(request)));
    }

    /**
     * Proposes a keyword the user can edit and send back as {@code keyword} of a lookup.
     */
    @GetMapping("/{sessionId}/items/{itemId}/keyword")
    public Map<String, String> suggestKeyword(@PathVariable final String sessionId,
                                              @PathVariable final int itemId) {
        return Map.of("keyword", sessionService.suggestKeyword(sessionId, itemId));
    }

    /**
     * Searches the catalog for every line item of the session.
     */
    @PostMapping("/{sessionId}/lookup")
    public List<RankResponse> lookupAll(@PathVariable final String sessionId,
                                        @RequestBody(required = false) @Validated final LookupRequest request) {
        return sessionService.lookupAll(sessionId, options(request)).stream()
                .map(RankResponse::from)
                .toList();
    }

    @GetMapping("/{sessionId}/items/{itemId}/candidates")
    public List<ScoredCandidate> candidates(@PathVariable final String sessionId,
                                            @PathVariable final int itemId) {
        return sessionService.get(sessionId).ranking(itemId);
    }

    @PutMapping(value = "/{sessionId}/items/{itemId}/selection", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LineItemView select(@PathVariable final String sessionId,
                               @PathVariable final int itemId,
                               @RequestBody @Validated final SelectionRequest request) {
        sessionService.select(sessionId, itemId, request.candidateId());
        return LineItemView.from(sessionService.get(sessionId).item(itemId));
    }

    @PutMapping("/{sessionId}/items/{itemId}/selection/not-available")
    public LineItemView markNotAvailable(@PathVariable final String sessionId,
                                         @PathVariable final int itemId) {
        sessionService.markNotAvailable(sessionId, itemId);
        return LineItemView.from(sessionService.get(sessionId).item(itemId));
    }

    @DeleteMapping("/{sessionId}/items/{itemId}/selection")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearSelection(@PathVariable final String sessionId,
                               @PathVariable final int itemId) {
        sessionService.clearSelection(sessionId, itemId);
    }

    @GetMapping("/{sessionId}/export")
    public List<ExportRow> export(@PathVariable final String sessionId) {
        return sessionService.export(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void close(@PathVariable final String sessionId) {
        sessionService.close(sessionId);
    }

    private RankingOptions options(final LookupRequest request) {
        return request == null
                ? rankingProperties.toOptions()
                : rankingProperties.toOptions(request.allowObsolete(), request.excludeZeroStock(),
                request.maxResults());
    }
}
