package com.foodtruck.product.dto;

import com.foodtruck.product.entity.ProductCategory;
import jakarta.validation.constraints.*;

import java.math.BigDecimal;

public record CreateProductRequest(
        @NotBlank(message = "name must not be empty")
        @Size(max = 80, message = "name must be at most 80 characters")
        String name,

        @Size(max = 255, message = "description must be at most 255 characters")
        String description,

        @NotNull(message = "price is required")
        @DecimalMin(value = "0.00", message = "price must not be negative")
        @Digits(integer = 8, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price,

        @NotNull(message = "category is required")
        ProductCategory category,

        Boolean available
) {}
