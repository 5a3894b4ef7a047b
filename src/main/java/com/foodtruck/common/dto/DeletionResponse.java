package com.foodtruck.common.dto;

public record DeletionResponse(Long id, DeletionOutcome outcome) {
}
