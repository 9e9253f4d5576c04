package com.components.bom.ai;

import com.components.bom.config.LookupProperties;
import com.components.bom.model.LineItem;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>Search keyword service</h2>
 *
 * <p>Builds the free-text catalog query for a line item. When a {@link KeywordGenerator} bean is
 * present it is asked first, decorated with the {@code keywordGeneration} retry and circuit
 * breaker; any failure, open circuit or blank answer falls back to {@link #suggestKeyword}.</p>
 *
 * <p>The heuristic keyword leaves the MPN out, since keyword search mostly runs after the MPN
 * search found nothing. It is assembled from, in order:</p>
 * <ol>
 *   <li>the Value,</li>
 *   <li>a 4-digit chip size code found in the Package (else the Package text itself),</li>
 *   <li>the first three words of the Description,</li>
 * </ol>
 * <p>de-duplicated ignoring case and cut to {@code lookup.keyword-max-tokens} tokens.</p>
 */
@Slf4j
@Component
public class KeywordService {

    private static final Pattern PACKAGE_CODE = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern WORDS = Pattern.compile("\\s+");
    private static final int DESCRIPTION_WORDS = 3;

    private final ObjectProvider<KeywordGenerator> generator;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final LookupProperties props;

    public KeywordService(final ObjectProvider<KeywordGenerator> generator,
                          @Qualifier("keywordRetry") final Retry retry,
                          @Qualifier("keywordCircuitBreaker") final CircuitBreaker circuitBreaker,
                          final LookupProperties props) {
        this.generator = Objects.requireNonNull(generator);
        this.retry = Objects.requireNonNull(retry);
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Returns the catalog search keyword for a line item.
     *
     * @param item line item to search for
     * @return the generated keyword, or the heuristic one; empty when the item has nothing to
     *         search by
     */
    public String keywordFor(final LineItem item) {
        KeywordGenerator ai = generator.getIfAvailable();
        if (ai == null) {
            return suggestKeyword(item);
        }

        Supplier<String> decorated = Decorators
                .ofSupplier(() -> requireKeyword(ai.generateKeyword(item)))
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(
                        List.of(Exception.class),
                        ex -> {
                            log.warn("Keyword generation failed for item {}: {} → using heuristic keyword",
                                    item.getId(), ex.toString());
                            return suggestKeyword(item);
                        })
                .decorate();
        return decorated.get();
    }

    /**
     * Heuristic keyword built from the item's own fields.
     *
     * @param item line item
     * @return space separated tokens, possibly empty
     */
    public String suggestKeyword(final LineItem item) {
        List<String> tokens = new ArrayList<>();
        item.value().ifPresent(v -> tokens.addAll(words(v)));
        item.packageCode().ifPresent(p -> {
            Matcher m = PACKAGE_CODE.matcher(p);
            if (m.find()) {
                tokens.add(m.group(1));
            } else {
                tokens.addAll(words(p));
            }
        });
        item.description().ifPresent(d -> words(d).stream().limit(DESCRIPTION_WORDS).forEach(tokens::add));

        Set<String> seen = new LinkedHashSet<>();
        List<String> kept = new ArrayList<>();
        for (String token : tokens) {
            if (kept.size() >= props.getKeywordMaxTokens()) {
                break;
            }
            if (seen.add(token.toLowerCase(Locale.ROOT))) {
                kept.add(token);
            }
        }
        String keyword = String.join(" ", kept);
        log.debug("Heuristic keyword for item {}: '{}'", item.getId(), keyword);
        return keyword;
    }

    private static String requireKeyword(final String keyword) {
        String cleaned = StringUtils.normalizeSpace(keyword);
        if (StringUtils.isBlank(cleaned)) {
            throw new IllegalStateException("keyword generator returned nothing");
        }
        return cleaned;
    }

    private static List<String> words(final String text) {
        return Arrays.stream(WORDS.split(text.trim()))
                .filter(StringUtils::isNotBlank)
                .toList();
    }
}
