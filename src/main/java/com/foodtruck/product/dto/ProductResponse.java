package com.foodtruck.product.dto;

import com.foodtruck.product.entity.Product;
import com.foodtruck.product.entity.ProductCategory;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ProductResponse(
        Long id,
        String name,
        String description,
        BigDecimal price,
        ProductCategory category,
        boolean available,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(product.getId(), product.getName(), product.getDescription(),
                product.getPrice(), product.getCategory(), product.isAvailable(),
                product.getCreatedAt(), product.getUpdatedAt());
    }
}
