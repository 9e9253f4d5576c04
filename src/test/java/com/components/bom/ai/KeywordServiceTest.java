package com.components.bom.ai;

import com.components.bom.config.LookupProperties;
import com.components.bom.model.FieldKey;
import com.components.bom.model.LineItem;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KeywordServiceTest {

    private ObjectProvider<KeywordGenerator> provider;
    private KeywordService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        provider = mock(ObjectProvider.class);
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(10))
                .build());
        service = new KeywordService(provider, retry, CircuitBreaker.ofDefaults("test"), new LookupProperties());
    }

    @Test
    void heuristicKeywordUsesValuePackageCodeAndDescription() {
        LineItem item = item(Map.of(
                FieldKey.VALUE, "100nF",
                FieldKey.PACKAGE, "C_0603_1608Metric",
                FieldKey.DESCRIPTION, "Ceramic capacitor X7R 50V"));

        assertThat(service.suggestKeyword(item)).isEqualTo("100nF 0603 Ceramic capacitor X7R");
    }

    @Test
    void heuristicKeywordLeavesOutMpnAndIsCappedAtMaxTokens() {
        LineItem item = item(Map.of(
                FieldKey.MPN, "GRM21BR61E106KA73L",
                FieldKey.VALUE, "10 uF",
                FieldKey.PACKAGE, "C_0805_2012Metric",
                FieldKey.DESCRIPTION, "Ceramic capacitor X5R 25V"));

        assertThat(service.suggestKeyword(item)).isEqualTo("10 uF 0805 Ceramic capacitor");
    }

    @Test
    void packageWithoutChipCodeIsUsedAsText() {
        LineItem item = item(Map.of(FieldKey.VALUE, "10k", FieldKey.PACKAGE, "SOT-23"));

        assertThat(service.suggestKeyword(item)).isEqualTo("10k SOT-23");
    }

    @Test
    void usesGeneratorWhenAvailable() {
        KeywordGenerator generator = mock(KeywordGenerator.class);
        when(generator.generateKeyword(any())).thenReturn("  1k   resistor 0603 ");
        when(provider.getIfAvailable()).thenReturn(generator);

        assertThat(service.keywordFor(item(Map.of(FieldKey.VALUE, "1k")))).isEqualTo("1k resistor 0603");
    }

    @Test
    void failingGeneratorFallsBackToHeuristicAfterRetries() {
        KeywordGenerator generator = mock(KeywordGenerator.class);
        when(generator.generateKeyword(any())).thenThrow(new IllegalStateException("model down"));
        when(provider.getIfAvailable()).thenReturn(generator);

        String keyword = service.keywordFor(item(Map.of(FieldKey.VALUE, "4.7uF", FieldKey.PACKAGE, "0805")));

        assertThat(keyword).isEqualTo("4.7uF 0805");
        verify(generator, times(2)).generateKeyword(any());
    }

    @Test
    void withoutGeneratorHeuristicIsUsed() {
        when(provider.getIfAvailable()).thenReturn(null);

        assertThat(service.keywordFor(item(Map.of(FieldKey.VALUE, "22pF")))).isEqualTo("22pF");
    }

    private static LineItem item(final Map<FieldKey, String> fields) {
        // keep canonical column order regardless of Map.of iteration order
        Map<FieldKey, String> ordered = new LinkedHashMap<>();
        for (FieldKey key : List.of(FieldKey.MPN, FieldKey.VALUE, FieldKey.PACKAGE, FieldKey.DESCRIPTION)) {
            if (fields.containsKey(key)) {
                ordered.put(key, fields.get(key));
            }
        }
        return new LineItem(1, ordered, List.of(), 1, List.of());
    }
}
