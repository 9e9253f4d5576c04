package com.components.bom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the BOM Ranker application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints to:
 * <ul>
 *   <li>open a BOM table and consolidate its rows into line items,</li>
 *   <li>find and rank distributor catalog candidates for each line item,</li>
 *   <li>record the selected part per line item and export the result.</li>
 * </ul>
 * A distributor catalog client and an AI keyword generator are optional beans; without a
 * catalog client, lookups answer 503 while ranking of client-supplied records still works.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 * }</pre>
 *
 * <p>Once started, the application serves requests under <code>/api/bom/sessions</code>.</p>
 */
@SpringBootApplication
public class BomRankerApplication {

    public static void main(final String[] args) {
        SpringApplication.run(BomRankerApplication.class, args);
    }
}
