package com.foodtruck.order.dto;

/**
 * One rated order's contribution to a product: all of its lines for that
 * product folded together, with the order's rating.
 */
public record OrderProductRating(
        Long productId,
        String productName,
        Long quantity,
        Integer rating
) {}
