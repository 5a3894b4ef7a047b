package com.foodtruck.product.dto;

import com.foodtruck.product.entity.ProductCategory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProductRequest(
        @Size(max = 80, message = "name must be at most 80 characters")
        @Pattern(regexp = ".*\\S.*", message = "name must not be empty")
        String name,

        @Size(max = 255, message = "description must be at most 255 characters")
        String description,

        @DecimalMin(value = "0.00", message = "price must not be negative")
        @Digits(integer = 8, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price,

        ProductCategory category,

        Boolean available
) {}
