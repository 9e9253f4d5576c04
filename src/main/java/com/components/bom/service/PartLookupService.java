package com.components.bom.service;

import com.components.bom.ai.KeywordService;
import com.components.bom.config.LookupProperties;
import com.components.bom.exception.CatalogUnavailableException;
import com.components.bom.model.LineItem;
import com.components.bom.parser.CandidateBatch;
import com.components.bom.parser.CandidateNormalizer;
import com.components.bom.service.core.CatalogSearchClient;
import com.components.bom.service.core.RankingEngine;
import com.components.bom.service.core.RankingOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <h2>Part lookup service</h2>
 *
 * <p>Finds and ranks catalog candidates for line items:</p>
 * <ol>
 *   <li>an item with an MPN is searched by part number;</li>
 *   <li>an item without MPN, or whose MPN search found nothing (when
 *       {@code lookup.keyword-fallback-on-empty-mpn-result} is on), is searched by keyword;</li>
 *   <li>the records are normalized and ranked.</li>
 * </ol>
 * <p>A keyword typed by the user replaces steps 1 and 2 with a single keyword search.</p>
 * <p>Catalog calls run under the {@code catalogSearch} retry and circuit breaker. A call that
 * still fails degrades to an empty result so one unreachable part never aborts a whole BOM.</p>
 */
@Slf4j
@Service
public class PartLookupService {

    private final ObjectProvider<CatalogSearchClient> catalog;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper mapper;
    private final CandidateNormalizer normalizer;
    private final RankingEngine rankingEngine;
    private final KeywordService keywordService;
    private final LookupProperties props;

    public PartLookupService(final ObjectProvider<CatalogSearchClient> catalog,
                             @Qualifier("catalogRetry") final Retry retry,
                             @Qualifier("catalogCircuitBreaker") final CircuitBreaker circuitBreaker,
                             @Qualifier("catalogObjectMapper") final ObjectMapper mapper,
                             final CandidateNormalizer normalizer,
                             final RankingEngine rankingEngine,
                             final KeywordService keywordService,
                             final LookupProperties props) {
        this.catalog = Objects.requireNonNull(catalog);
        this.retry = Objects.requireNonNull(retry);
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker);
        this.mapper = Objects.requireNonNull(mapper);
        this.normalizer = Objects.requireNonNull(normalizer);
        this.rankingEngine = Objects.requireNonNull(rankingEngine);
        this.keywordService = Objects.requireNonNull(keywordService);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Looks up and ranks candidates for one line item.
     *
     * @param item    line item
     * @param options ranking filters
     * @return the lookup result, never {@code null}
     * @throws CatalogUnavailableException if no catalog client is configured
     */
    public LookupResult lookup(final LineItem item, final RankingOptions options) {
        CatalogSearchClient client = requireClient();

        String mpn = item.mpn().orElse(null);
        if (mpn != null) {
            List<Map<String, Object>> records = search("MPN " + mpn, () -> client.searchByPartNumber(mpn));
            if (!records.isEmpty() || !props.isKeywordFallbackOnEmptyMpnResult()) {
                return rank(item, LookupStrategy.MPN, mpn, records, options);
            }
            log.info("Item {}: no catalog match for MPN {}, trying keyword search", item.getId(), mpn);
        }

        String keyword = keywordService.keywordFor(item);
        if (StringUtils.isBlank(keyword)) {
            log.warn("Item {}: nothing to search by", item.getId());
            return LookupResult.none(item.getId());
        }
        List<Map<String, Object>> records = search("keyword '" + keyword + "'",
                () -> client.searchByKeyword(keyword, props.getKeywordMaxResults()));
        return rank(item, LookupStrategy.KEYWORD, keyword, records, options);
    }

    /**
     * Searches the catalog with a user-supplied keyword, skipping the MPN search and the keyword
     * generator. A blank keyword falls back to {@link #lookup(LineItem, RankingOptions)}.
     *
     * @param item    line item
     * @param keyword search text, e.g. an edited {@code KeywordService#suggestKeyword} proposal
     * @param options ranking filters
     * @return the lookup result, never {@code null}
     * @throws CatalogUnavailableException if no catalog client is configured
     */
    public LookupResult lookup(final LineItem item, final String keyword, final RankingOptions options) {
        String cleaned = StringUtils.normalizeSpace(keyword);
        if (StringUtils.isBlank(cleaned)) {
            return lookup(item, options);
        }
        CatalogSearchClient client = requireClient();
        log.info("Item {}: searching by user keyword '{}'", item.getId(), cleaned);
        List<Map<String, Object>> records = search("keyword '" + cleaned + "'",
                () -> client.searchByKeyword(cleaned, props.getKeywordMaxResults()));
        return rank(item, LookupStrategy.KEYWORD, cleaned, records, options);
    }

    /**
     * Looks up every line item, {@code lookup.concurrency} at a time.
     *
     * @param items   line items
     * @param options ranking filters
     * @return one result per item, in item order; an item whose lookup failed gets
     *         {@link LookupResult#none(int)}
     * @throws CatalogUnavailableException if no catalog client is configured
     */
    public List<LookupResult> lookupAll(final List<LineItem> items, final RankingOptions options) {
        requireClient();
        List<LookupResult> results = Flux.fromIterable(items)
                .flatMapSequential(item -> Mono.fromCallable(() -> lookup(item, options))
                                .subscribeOn(Schedulers.boundedElastic())
                                .onErrorResume(ex -> {
                                    log.warn("Item {}: lookup failed: {} → no candidates", item.getId(), ex.toString());
                                    return Mono.just(LookupResult.none(item.getId()));
                                }),
                        props.getConcurrency())
                .collectList()
                .block();
        log.info("Looked up {} line items", items.size());
        return results == null ? List.of() : results;
    }

    private LookupResult rank(final LineItem item,
                              final LookupStrategy strategy,
                              final String searchKey,
                              final List<Map<String, Object>> records,
                              final RankingOptions options) {
        List<JsonNode> nodes = records.stream()
                .map(r -> (JsonNode) mapper.valueToTree(r))
                .toList();
        CandidateBatch batch = normalizer.normalizeAll(nodes);
        LookupResult result = new LookupResult(item.getId(), strategy, searchKey,
                rankingEngine.rank(item, batch.candidates(), options), batch.rejected());
        log.info("Item {}: {} search '{}' → {} ranked, {} rejected",
                item.getId(), strategy, searchKey, result.ranked().size(), result.rejected().size());
        return result;
    }

    private List<Map<String, Object>> search(final String what,
                                             final Supplier<List<Map<String, Object>>> call) {
        Supplier<List<Map<String, Object>>> decorated = Decorators
                .ofSupplier(call)
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(
                        List.of(Exception.class),
                        ex -> {
                            log.warn("Catalog search by {} failed: {} → empty result", what, ex.toString());
                            return List.of();
                        })
                .decorate();
        List<Map<String, Object>> records = decorated.get();
        return records == null ? List.of() : records;
    }

    private CatalogSearchClient requireClient() {
        CatalogSearchClient client = catalog.getIfAvailable();
        if (client == null) {
            throw new CatalogUnavailableException("No catalog search client is configured");
        }
        return client;
    }
}
