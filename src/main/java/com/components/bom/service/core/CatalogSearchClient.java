package com.components.bom.service.core;

import java.util.List;
import java.util.Map;

/**
 * Distributor catalog search, e.g. the Mouser search API.
 * <p>
 * Implementations return the catalog's native part records untouched, one map per part; the
 * lookup layer converts them into candidates. Failures are reported by throwing, the caller
 * takes care of retries.
 * </p>
 */
public interface CatalogSearchClient {

    /**
     * Searches the catalog for an exact manufacturer part number.
     *
     * @param partNumber manufacturer part number
     * @return native part records, empty when the catalog knows no such part
     */
    List<Map<String, Object>> searchByPartNumber(String partNumber);

    /**
     * Free-text catalog search.
     *
     * @param keyword    search text
     * @param maxResults maximum number of records to return
     * @return native part records in catalog order
     */
    List<Map<String, Object>> searchByKeyword(String keyword, int maxResults);
}
