package com.components.bom.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param candidateId id of a candidate from the line item's current ranking
 */
public record SelectionRequest(@NotBlank String candidateId) {
}
