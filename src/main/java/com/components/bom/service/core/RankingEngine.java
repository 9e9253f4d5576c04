package com.components.bom.service.core;

import com.components.bom.model.Candidate;
import com.components.bom.model.LifecycleStatus;
import com.components.bom.model.LineItem;
import com.components.bom.model.ScoreBreakdown;
import com.components.bom.model.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <h2>Candidate ranking engine</h2>
 *
 * <p>Orders the catalog candidates of one line item by a weighted multi-criteria score:</p>
 * <pre>
 * score = 0.30 * stock + 0.50 * price + 0.10 * lifecycle + 0.10 * package
 * </pre>
 * <ul>
 *   <li><b>stock</b> {@code min(1, ln(1 + stock) / ln(1 + n))} for the required quantity
 *       {@code n}; no stock scores 0.</li>
 *   <li><b>price</b> cheapest price of the set divided by the candidate's price, both resolved at
 *       {@code n}; unknown prices score 0.</li>
 *   <li><b>lifecycle</b> Active 1.0, NRND 0.4, Unknown 0.3, Obsolete 0.0.</li>
 *   <li><b>package</b> see {@link PackageMatcher}.</li>
 * </ul>
 * <p>Obsolete and (optionally) zero-stock candidates are filtered out before scoring, so they
 * never influence the price baseline. Ties keep fetch order.</p>
 */
@Slf4j
@Component
public class RankingEngine {

    public static final double STOCK_WEIGHT = 0.30;
    public static final double PRICE_WEIGHT = 0.50;
    public static final double LIFECYCLE_WEIGHT = 0.10;
    public static final double PACKAGE_WEIGHT = 0.10;

    private final PackageMatcher packageMatcher;

    public RankingEngine(final PackageMatcher packageMatcher) {
        this.packageMatcher = Objects.requireNonNull(packageMatcher);
    }

    /**
     * Ranks candidates for a line item. Neither the item nor the candidates are modified.
     *
     * @param item       the line item the candidates were found for
     * @param candidates candidates in fetch order
     * @param options    filters and result limit
     * @return scored candidates, best first; empty for an empty input
     */
    public List<ScoredCandidate> rank(final LineItem item,
                                      final List<Candidate> candidates,
                                      final RankingOptions options) {
        Objects.requireNonNull(item, "item");
        RankingOptions opts = options == null ? RankingOptions.defaults() : options;
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        int required = Math.max(1, item.getQuantity());
        String requiredPackage = item.packageCode().orElse(null);

        List<Candidate> eligible = candidates.stream()
                .filter(Objects::nonNull)
                .filter(c -> opts.allowObsolete() || c.lifecycleStatus() != LifecycleStatus.OBSOLETE)
                .filter(c -> !opts.excludeZeroStock() || c.stockQuantity() > 0)
                .toList();

        List<BigDecimal> prices = eligible.stream()
                .map(c -> PriceResolver.priceAt(c, required))
                .toList();
        BigDecimal minPrice = prices.stream()
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);

        List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
        for (int i = 0; i < eligible.size(); i++) {
            Candidate c = eligible.get(i);
            BigDecimal price = prices.get(i);
            ScoreBreakdown breakdown = new ScoreBreakdown(
                    stockScore(c.stockQuantity(), required),
                    priceScore(price, minPrice),
                    lifecycleScore(c.lifecycleStatus()),
                    packageMatcher.score(requiredPackage, c.packageCode()),
                    price,
                    required);
            double total = STOCK_WEIGHT * breakdown.stock()
                    + PRICE_WEIGHT * breakdown.price()
                    + LIFECYCLE_WEIGHT * breakdown.lifecycle()
                    + PACKAGE_WEIGHT * breakdown.packageMatch();
            log.debug("Item {} candidate {}: score {} ({})", item.getId(), c.candidateId(), total, breakdown);
            scored.add(new ScoredCandidate(c, total, breakdown));
        }

        // List.sort is stable
        scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
        if (opts.maxResults() > 0 && scored.size() > opts.maxResults()) {
            scored = new ArrayList<>(scored.subList(0, opts.maxResults()));
        }
        log.info("Item {}: ranked {} of {} candidates", item.getId(), scored.size(), candidates.size());
        return List.copyOf(scored);
    }

    static double stockScore(final int stock, final int required) {
        if (stock <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.log1p(stock) / Math.log1p(required));
    }

    static double priceScore(final BigDecimal price, final BigDecimal minPrice) {
        if (price == null || minPrice == null) {
            return 0.0;
        }
        if (price.signum() == 0) {
            return 1.0;
        }
        return Math.min(1.0, minPrice.divide(price, MathContext.DECIMAL64).doubleValue());
    }

    static double lifecycleScore(final LifecycleStatus status) {
        return switch (status == null ? LifecycleStatus.UNKNOWN : status) {
            case ACTIVE -> 1.0;
            case NRND -> 0.4;
            case OBSOLETE -> 0.0;
            case UNKNOWN -> 0.3;
        };
    }
}
