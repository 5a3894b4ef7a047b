package com.foodtruck.order.dto;

import jakarta.validation.constraints.Size;

/**
 * A null value clears the notes.
 */
public record UpdateNotesRequest(
        @Size(max = 255, message = "notes must be at most 255 characters")
        String notes
) {}
