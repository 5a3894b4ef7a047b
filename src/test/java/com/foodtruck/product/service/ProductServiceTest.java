package com.foodtruck.product.service;

import com.foodtruck.common.dto.DeletionOutcome;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.security.AccessPolicy;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.order.repository.OrderRepository;
import com.foodtruck.product.dto.CreateProductRequest;
import com.foodtruck.product.dto.ProductResponse;
import com.foodtruck.product.dto.UpdateProductRequest;
import com.foodtruck.product.entity.Product;
import com.foodtruck.product.entity.ProductCategory;
import com.foodtruck.product.repository.ProductRepository;
import com.foodtruck.user.entity.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private OrderRepository orderRepository;
    @Spy
    private AccessPolicy accessPolicy = new AccessPolicy();

    @InjectMocks
    private ProductService productService;

    private final AuthenticatedUser admin = new AuthenticatedUser(1L, Role.ADMIN);
    private final AuthenticatedUser staff = new AuthenticatedUser(2L, Role.STAFF);

    @Test
    @DisplayName("Admin creates a product, available by default")
    void createProduct_Success() {
        given(productRepository.existsByName("Taco")).willReturn(false);
        given(productRepository.save(any(Product.class))).willAnswer(invocation -> invocation.getArgument(0));

        ProductResponse response = productService.createProduct(admin, new CreateProductRequest(
                "Taco", "Al pastor", new BigDecimal("4.25"), ProductCategory.FOOD, null));

        assertThat(response.name()).isEqualTo("Taco");
        assertThat(response.available()).isTrue();
        assertThat(response.price()).isEqualByComparingTo("4.25");
    }

    @Test
    @DisplayName("Staff cannot write the catalog")
    void createProduct_StaffDenied() {
        assertThatThrownBy(() -> productService.createProduct(staff, new CreateProductRequest(
                "Taco", null, BigDecimal.ONE, ProductCategory.FOOD, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
        verifyNoInteractions(productRepository);
    }

    @Test
    void createProduct_DuplicateName() {
        given(productRepository.existsByName("Taco")).willReturn(true);

        assertThatThrownBy(() -> productService.createProduct(admin, new CreateProductRequest(
                "Taco", null, BigDecimal.ONE, ProductCategory.FOOD, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.DUPLICATE_PRODUCT_NAME);
        verify(productRepository, never()).save(any());
    }

    @Test
    void createProduct_NegativePrice() {
        assertThatThrownBy(() -> productService.createProduct(admin, new CreateProductRequest(
                "Taco", null, new BigDecimal("-1.00"), ProductCategory.FOOD, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_PRICE);
    }

    @Test
    @DisplayName("Partial update leaves null fields untouched")
    void updateProduct_Partial() {
        Product taco = product(5L, "Taco", "4.25", true);
        given(productRepository.findById(5L)).willReturn(Optional.of(taco));

        ProductResponse response = productService.updateProduct(admin, 5L,
                new UpdateProductRequest(null, null, new BigDecimal("4.75"), null, false));

        assertThat(response.name()).isEqualTo("Taco");
        assertThat(response.price()).isEqualByComparingTo("4.75");
        assertThat(response.available()).isFalse();
    }

    @Test
    void getOrderableProduct_Unavailable() {
        given(productRepository.findByIdForUpdate(5L)).willReturn(Optional.of(product(5L, "Taco", "4.25", false)));

        assertThatThrownBy(() -> productService.getOrderableProduct(5L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PRODUCT_UNAVAILABLE);
    }

    @Test
    @DisplayName("Orderable product is read under a row lock")
    void getOrderableProduct_LocksRow() {
        Product taco = product(5L, "Taco", "4.25", true);
        given(productRepository.findByIdForUpdate(5L)).willReturn(Optional.of(taco));

        assertThat(productService.getOrderableProduct(5L)).isSameAs(taco);
        verify(productRepository, never()).findById(any());
    }

    @Test
    void deleteProduct_NotFound() {
        given(productRepository.findByIdForUpdate(404L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> productService.deleteProduct(admin, 404L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PRODUCT_NOT_FOUND);
        verifyNoInteractions(orderRepository);
    }

    @Test
    void getProduct_NotFound() {
        given(productRepository.findById(404L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> productService.getProduct(404L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PRODUCT_NOT_FOUND);
    }

    @Test
    @DisplayName("Product referenced by an open order is only deactivated")
    void deleteProduct_ReferencedByOpenOrder() {
        Product taco = product(5L, "Taco", "4.25", true);
        given(productRepository.findByIdForUpdate(5L)).willReturn(Optional.of(taco));
        given(orderRepository.existsItemForProductInStatuses(eq(5L), anyCollection())).willReturn(true);

        DeletionResponse response = productService.deleteProduct(admin, 5L);

        assertThat(response.outcome()).isEqualTo(DeletionOutcome.DEACTIVATED);
        assertThat(taco.isAvailable()).isFalse();
        verify(productRepository, never()).delete(any());
    }

    @Test
    @DisplayName("Unreferenced product is removed")
    void deleteProduct_Unreferenced() {
        Product taco = product(5L, "Taco", "4.25", true);
        given(productRepository.findByIdForUpdate(5L)).willReturn(Optional.of(taco));
        given(orderRepository.existsItemForProductInStatuses(eq(5L), anyCollection())).willReturn(false);

        DeletionResponse response = productService.deleteProduct(admin, 5L);

        assertThat(response.outcome()).isEqualTo(DeletionOutcome.DELETED);
        verify(productRepository).delete(taco);
    }

    private static Product product(Long id, String name, String price, boolean available) {
        Product product = Product.builder()
                .name(name)
                .price(new BigDecimal(price))
                .category(ProductCategory.FOOD)
                .available(available)
                .build();
        ReflectionTestUtils.setField(product, "id", id);
        return product;
    }
}
