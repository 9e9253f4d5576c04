package com.components.bom.parser.mouser;

import com.components.bom.exception.CandidateParseException;
import com.components.bom.model.Candidate;
import com.components.bom.model.LifecycleStatus;
import com.components.bom.model.PriceBreak;
import com.components.bom.parser.CandidateNormalizer;
import com.components.bom.parser.Prices;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <h2>Mouser candidate normalizer</h2>
 * <p>Converts one part record of the Mouser search API ({@code SearchResults.Parts[]}) into a
 * {@link Candidate}. The API is not consistent across endpoints and versions, so each canonical
 * field is read from the first populated of several native names:</p>
 * <pre>{@code
 * {
 *   "ManufacturerPartNumber": "RC0603FR-071KL",
 *   "Manufacturer": "YAGEO",
 *   "MouserPartNumber": "603-RC0603FR-071KL",
 *   "Description": "Thick Film Resistors - SMD 1K OHM 1%",
 *   "LifecycleStatus": null,
 *   "AvailabilityInStock": "1234567",
 *   "PriceBreaks": [ {"Quantity": 1, "Price": "$0.10", "Currency": "USD"}, … ],
 *   "ProductAttributes": [ {"AttributeName": "Package / Case", "AttributeValue": "0603 (1608 metric)"} ]
 * }
 * }</pre>
 * <p>Optional data falls back to conservative defaults: no stock information means a stock of
 * zero, no lifecycle means {@link LifecycleStatus#UNKNOWN}, and a record without price breaks
 * uses its unit price as the only break.</p>
 */
@Slf4j
@Component("mouserCandidateNormalizer")
public class MouserCandidateNormalizer implements CandidateNormalizer {

    /** Leading integer of availability text such as "1,234 In Stock". */
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([0-9][0-9,.]*)");

    /** Attribute names that carry the package / case of a part. */
    private static final List<String> PACKAGE_ATTRIBUTES = List.of(
            "Package / Case", "Package", "Case Code - in", "Case Code - mm");

    @Override
    public Candidate normalize(final JsonNode record) {
        if (record == null || !record.isObject()) {
            throw new CandidateParseException("catalog record is not an object");
        }
        String partNumber = text(record, "ManufacturerPartNumber", "MfrPartNumber");
        if (partNumber == null) {
            throw new CandidateParseException("catalog record has no manufacturer part number");
        }

        String manufacturer = text(record, "Manufacturer", "Mfr");
        String distributorNumber = text(record, "MouserPartNumber", "PartNumber");
        String candidateId = distributorNumber != null
                ? distributorNumber
                : StringUtils.defaultString(manufacturer) + ":" + partNumber;

        Map<String, String> attributes = readAttributes(record);
        String packageCode = Optional.ofNullable(text(record, "Package", "CaseCode"))
                .orElseGet(() -> packageFromAttributes(attributes));

        List<PriceBreak> breaks = readPriceBreaks(record, partNumber);
        BigDecimal unitPrice = referencePrice(breaks);
        if (unitPrice == null) {
            unitPrice = price(record.path("UnitPrice")).or(() -> price(record.path("Price"))).orElse(null);
            if (unitPrice != null) {
                breaks = List.of(new PriceBreak(1, unitPrice, text(record, "Currency")));
            }
        }

        return new Candidate(
                candidateId,
                partNumber,
                manufacturer,
                text(record, "Description", "ProductDescription"),
                packageCode,
                unitPrice,
                breaks,
                readStock(record),
                LifecycleStatus.fromVendorText(text(record, "LifecycleStatus", "Status")),
                attributes);
    }

    private static Map<String, String> readAttributes(final JsonNode record) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (JsonNode attr : record.path("ProductAttributes")) {
            String name = text(attr, "AttributeName");
            String value = text(attr, "AttributeValue");
            if (name != null && value != null) {
                attributes.putIfAbsent(name, value);
            }
        }
        putIfPresent(attributes, Candidate.ATTR_DATASHEET_URL, text(record, "DataSheetUrl", "DataSheet"));
        putIfPresent(attributes, Candidate.ATTR_PRODUCT_URL, text(record, "ProductDetailUrl", "ProductUrl"));
        putIfPresent(attributes, "ROHSStatus", text(record, "ROHSStatus"));
        putIfPresent(attributes, "LeadTime", text(record, "LeadTime"));
        JsonNode availability = record.path("Availability");
        if (availability.isObject()) {
            putIfPresent(attributes, "LeadTime", text(availability, "LeadTime"));
        }
        return attributes;
    }

    private static String packageFromAttributes(final Map<String, String> attributes) {
        return PACKAGE_ATTRIBUTES.stream()
                .map(attributes::get)
                .filter(StringUtils::isNotBlank)
                .findFirst()
                .orElse(null);
    }

    private static List<PriceBreak> readPriceBreaks(final JsonNode record, final String partNumber) {
        List<PriceBreak> breaks = new ArrayList<>();
        for (JsonNode pb : record.path("PriceBreaks")) {
            int quantity = pb.path("Quantity").asInt(0);
            Optional<BigDecimal> price = price(pb.path("Price"));
            if (quantity < 1 || price.isEmpty()) {
                log.debug("Part {}: skipping unusable price break {}", partNumber, pb);
                continue;
            }
            breaks.add(new PriceBreak(quantity, price.get(), text(pb, "Currency")));
        }
        breaks.sort(Comparator.comparingInt(PriceBreak::quantity));
        return breaks;
    }

    /**
     * Unit price of the quantity-1 break, else of the lowest break.
     */
    private static BigDecimal referencePrice(final List<PriceBreak> breaks) {
        return breaks.stream()
                .filter(pb -> pb.quantity() == 1)
                .findFirst()
                .or(() -> breaks.stream().findFirst())
                .map(PriceBreak::price)
                .orElse(null);
    }

    private static int readStock(final JsonNode record) {
        int stock = parseCount(record.path("AvailabilityInStock"));
        if (stock > 0) {
            return stock;
        }
        JsonNode availability = record.path("Availability");
        if (availability.isObject()) {
            stock = parseCount(availability.path("OnHand"));
            return stock > 0 ? stock : parseCount(availability.path("Quantity"));
        }
        return parseCount(availability);
    }

    private static int parseCount(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return (int) Math.max(0, Math.min(Integer.MAX_VALUE, node.asLong()));
        }
        Matcher m = LEADING_NUMBER.matcher(node.asText());
        if (!m.find()) {
            return 0;
        }
        String digits = m.group(1).replaceAll("[,.]", "");
        try {
            return (int) Math.min(Integer.MAX_VALUE, Long.parseLong(digits));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static Optional<BigDecimal> price(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            BigDecimal value = node.decimalValue();
            return value.signum() < 0 ? Optional.empty() : Optional.of(value);
        }
        return Prices.parse(node.asText());
    }

    private static String text(final JsonNode node, final String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && StringUtils.isNotBlank(value.asText())) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static void putIfPresent(final Map<String, String> map, final String key, final String value) {
        if (value != null) {
            map.putIfAbsent(key, value);
        }
    }
}
