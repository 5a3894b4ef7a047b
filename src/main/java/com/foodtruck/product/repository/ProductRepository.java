package com.foodtruck.product.repository;

import com.foodtruck.product.entity.Product;
import com.foodtruck.product.entity.ProductCategory;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    Page<Product> findByCategory(ProductCategory category, Pageable pageable);

    Page<Product> findByAvailableTrue(Pageable pageable);

    Page<Product> findByCategoryAndAvailableTrue(ProductCategory category, Pageable pageable);

    /**
     * Row lock shared by order placement and product deletion, so a delete
     * always sees orders committed before it and an order never snapshots a
     * product that is being removed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :id")
    Optional<Product> findByIdForUpdate(@Param("id") Long id);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);
}
