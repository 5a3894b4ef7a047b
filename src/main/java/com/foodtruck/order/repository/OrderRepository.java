package com.foodtruck.order.repository;

import com.foodtruck.order.dto.OrderProductRating;
import com.foodtruck.order.entity.Order;
import com.foodtruck.order.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * Order and its lines in one query.
     */
    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") Long id);

    /**
     * SELECT ... FOR UPDATE on the order row. Every write to an order goes
     * through this so concurrent transitions and item edits serialize.
     * Items are not fetched here: PostgreSQL refuses FOR UPDATE on the
     * nullable side of an outer join. They load lazily inside the same
     * transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") Long id);

    Page<Order> findByUserId(Long userId, Pageable pageable);

    Page<Order> findByStatus(OrderStatus status, Pageable pageable);

    Page<Order> findByUserIdAndStatus(Long userId, OrderStatus status, Pageable pageable);

    boolean existsByUserId(Long userId);

    @Query("SELECT CASE WHEN COUNT(i) > 0 THEN true ELSE false END FROM OrderItem i "
            + "WHERE i.productId = :productId AND i.order.status IN :statuses")
    boolean existsItemForProductInStatuses(@Param("productId") Long productId,
                                           @Param("statuses") Collection<OrderStatus> statuses);

    /**
     * One row per rated order and product it contains. Lines of the same
     * product within an order are folded into a single row, so the caller can
     * weight every order equally.
     */
    @Query("SELECT new com.foodtruck.order.dto.OrderProductRating("
            + "i.productId, MAX(i.productName), SUM(i.quantity), o.rating) "
            + "FROM OrderItem i JOIN i.order o "
            + "WHERE o.rating IS NOT NULL "
            + "GROUP BY i.productId, o.id, o.rating "
            + "ORDER BY i.productId, o.id")
    List<OrderProductRating> findRatedOrderLinesByProduct();
}
