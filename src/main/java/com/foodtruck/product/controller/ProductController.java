package com.foodtruck.product.controller;

import com.foodtruck.common.dto.ApiResponse;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.common.security.AuthenticationFilter;
import com.foodtruck.product.dto.CreateProductRequest;
import com.foodtruck.product.dto.ProductResponse;
import com.foodtruck.product.dto.UpdateProductRequest;
import com.foodtruck.product.entity.ProductCategory;
import com.foodtruck.product.service.ProductService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * Reads are public; the authentication filter lets GET through without a token.
 * Writes require an admin token.
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @GetMapping
    public ApiResponse<PageResponse<ProductResponse>> listProducts(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + PageQuery.DEFAULT_LIMIT) int limit,
            @RequestParam(required = false) ProductCategory category,
            @RequestParam(defaultValue = "false") boolean availableOnly) {
        return ApiResponse.ok(productService.listProducts(PageQuery.of(offset, limit), category, availableOnly));
    }

    @GetMapping("/{id}")
    public ApiResponse<ProductResponse> getProduct(@PathVariable Long id) {
        return ApiResponse.ok(productService.getProduct(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ProductResponse> createProduct(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @Valid @RequestBody CreateProductRequest request) {
        return ApiResponse.ok(productService.createProduct(actor, request));
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ApiResponse<ProductResponse> updateProduct(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody UpdateProductRequest request) {
        return ApiResponse.ok(productService.updateProduct(actor, id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<DeletionResponse> deleteProduct(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(productService.deleteProduct(actor, id));
    }
}
