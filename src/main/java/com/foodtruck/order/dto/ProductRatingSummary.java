package com.foodtruck.order.dto;

import java.util.List;

/**
 * Public rating aggregate for one product.
 *
 * <p>Each rated order counts once toward {@code ratingCount} and
 * {@code averageRating}, however many lines of the product it holds.
 * {@code totalQuantity} sums the units across those orders.</p>
 */
public record ProductRatingSummary(
        Long productId,
        String productName,
        Long totalQuantity,
        Long ratingCount,
        Double averageRating
) {

    /**
     * @param orders rows for a single product, oldest order first; the name
     *               shown is the one snapshotted by the newest order
     */
    public static ProductRatingSummary of(List<OrderProductRating> orders) {
        OrderProductRating latest = orders.get(orders.size() - 1);
        long totalQuantity = orders.stream().mapToLong(OrderProductRating::quantity).sum();
        double average = orders.stream().mapToInt(OrderProductRating::rating).average().orElse(0);
        return new ProductRatingSummary(latest.productId(), latest.productName(),
                totalQuantity, (long) orders.size(), average);
    }
}
