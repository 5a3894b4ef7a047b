package com.foodtruck.publicapi;

import com.foodtruck.common.dto.ApiResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.order.dto.ProductRatingSummary;
import com.foodtruck.order.service.OrderService;
import com.foodtruck.product.dto.ProductResponse;
import com.foodtruck.product.entity.ProductCategory;
import com.foodtruck.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read models for the customer-facing menu board. No token required.
 */
@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class PublicController {

    private final ProductService productService;
    private final OrderService orderService;

    @GetMapping("/products")
    public ApiResponse<PageResponse<ProductResponse>> availableProducts(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + PageQuery.DEFAULT_LIMIT) int limit,
            @RequestParam(required = false) ProductCategory category) {
        return ApiResponse.ok(productService.listProducts(PageQuery.of(offset, limit), category, true));
    }

    @GetMapping("/ratings")
    public ApiResponse<List<ProductRatingSummary>> productRatings() {
        return ApiResponse.ok(orderService.getProductRatings());
    }
}
