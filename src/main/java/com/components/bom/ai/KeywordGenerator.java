package com.components.bom.ai;

import com.components.bom.model.LineItem;

/**
 * Produces one catalog search string for a line item, typically by asking a language model.
 * Implementations may be slow and may fail; callers wrap them with retry and a fallback.
 */
@FunctionalInterface
public interface KeywordGenerator {

    /**
     * @param item the line item to describe
     * @return a short search string; blank means "no suggestion"
     */
    String generateKeyword(LineItem item);
}
