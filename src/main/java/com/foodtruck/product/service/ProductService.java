package com.foodtruck.product.service;

import com.foodtruck.common.dto.DeletionOutcome;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.security.AccessPolicy;
import com.foodtruck.common.security.AccessResource;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.order.entity.OrderStatus;
import com.foodtruck.order.repository.OrderRepository;
import com.foodtruck.product.dto.CreateProductRequest;
import com.foodtruck.product.dto.ProductResponse;
import com.foodtruck.product.dto.UpdateProductRequest;
import com.foodtruck.product.entity.Product;
import com.foodtruck.product.entity.ProductCategory;
import com.foodtruck.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

import static com.foodtruck.common.security.AccessAction.*;

/**
 * Catalog reads for everyone and catalog writes for admins.
 *
 * <p>Single-product reads go through the {@code products} cache. Writes evict
 * the entry after their transaction commits. Deletion and order placement
 * both take the product row lock, so a product is removed only when no order
 * in progress refers to it.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProductService {

    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final AccessPolicy accessPolicy;

    /**
     * Cached per id in the local Caffeine cache; writes below evict the entry.
     */
    @Cacheable(value = "products", key = "#id")
    public ProductResponse getProduct(Long id) {
        return ProductResponse.from(findProduct(id));
    }

    /**
     * Products in id order, optionally narrowed to one category or to products
     * that can currently be ordered.
     */
    public PageResponse<ProductResponse> listProducts(PageQuery page, ProductCategory category,
                                                      boolean availableOnly) {
        Pageable pageable = page.toPageable(Sort.by("id"));
        Page<Product> products;
        if (category != null && availableOnly) {
            products = productRepository.findByCategoryAndAvailableTrue(category, pageable);
        } else if (category != null) {
            products = productRepository.findByCategory(category, pageable);
        } else if (availableOnly) {
            products = productRepository.findByAvailableTrue(pageable);
        } else {
            products = productRepository.findAll(pageable);
        }
        return PageResponse.of(products, page, ProductResponse::from);
    }

    /**
     * Loads a product that can be put on an order right now. Always reads the
     * database so price and availability are current at snapshot time.
     *
     * <p>The row stays locked until the calling order transaction commits, which
     * keeps {@link #deleteProduct} from removing a product that is about to be
     * referenced.</p>
     */
    @Transactional
    public Product getOrderableProduct(Long id) {
        Product product = findProductForUpdate(id);
        if (!product.isAvailable()) {
            throw new BusinessException(ErrorCode.PRODUCT_UNAVAILABLE,
                    "Product " + id + " (" + product.getName() + ") is not available");
        }
        return product;
    }

    @Transactional
    public ProductResponse createProduct(AuthenticatedUser actor, CreateProductRequest request) {
        accessPolicy.check(actor, AccessResource.PRODUCT, CREATE, false);
        validatePrice(request.price());
        if (productRepository.existsByName(request.name())) {
            throw new BusinessException(ErrorCode.DUPLICATE_PRODUCT_NAME,
                    "Product '" + request.name() + "' already exists");
        }

        Product product = Product.builder()
                .name(request.name())
                .description(request.description())
                .price(request.price())
                .category(request.category())
                .available(request.available())
                .build();

        product = productRepository.save(product);
        log.info("Product created: productId={}, name={}, price={}",
                product.getId(), product.getName(), product.getPrice());
        return ProductResponse.from(product);
    }

    /**
     * Partial update: null fields are left as they are. A new name must not
     * belong to another product.
     */
    @Transactional
    @CacheEvict(value = "products", key = "#id")
    public ProductResponse updateProduct(AuthenticatedUser actor, Long id, UpdateProductRequest request) {
        accessPolicy.check(actor, AccessResource.PRODUCT, UPDATE, false);
        Product product = findProduct(id);

        if (request.name() != null && !request.name().equals(product.getName())) {
            if (productRepository.existsByNameAndIdNot(request.name(), id)) {
                throw new BusinessException(ErrorCode.DUPLICATE_PRODUCT_NAME,
                        "Product '" + request.name() + "' already exists");
            }
            product.rename(request.name());
        }
        if (request.description() != null) {
            product.changeDescription(request.description());
        }
        if (request.price() != null) {
            validatePrice(request.price());
            product.changePrice(request.price());
        }
        if (request.category() != null) {
            product.changeCategory(request.category());
        }
        if (request.available() != null) {
            if (request.available()) {
                product.markAvailable();
            } else {
                product.markUnavailable();
            }
        }

        log.info("Product updated: productId={}", id);
        return ProductResponse.from(product);
    }

    /**
     * Hard delete unless an order that is still in progress references the
     * product, in which case it is only marked unavailable.
     */
    @Transactional
    @CacheEvict(value = "products", key = "#id")
    public DeletionResponse deleteProduct(AuthenticatedUser actor, Long id) {
        accessPolicy.check(actor, AccessResource.PRODUCT, DELETE, false);
        Product product = findProductForUpdate(id);

        if (orderRepository.existsItemForProductInStatuses(id, OrderStatus.activeStatuses())) {
            product.markUnavailable();
            log.info("Product deactivated (referenced by open orders): productId={}", id);
            return new DeletionResponse(id, DeletionOutcome.DEACTIVATED);
        }

        productRepository.delete(product);
        log.info("Product deleted: productId={}", id);
        return new DeletionResponse(id, DeletionOutcome.DELETED);
    }

    private Product findProduct(Long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND,
                        "Product " + id + " not found"));
    }

    private Product findProductForUpdate(Long id) {
        return productRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRODUCT_NOT_FOUND,
                        "Product " + id + " not found"));
    }

    private void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_PRICE);
        }
    }
}
