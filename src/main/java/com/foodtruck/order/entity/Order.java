package com.foodtruck.order.entity;

import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Order aggregate root.
 *
 * <p>Owns its {@link OrderItem}s and keeps {@code totalAmount} equal to the sum
 * of their subtotals. Lines may only be added, changed or removed while the
 * order is {@link OrderStatus#CREATED}; status moves are checked against
 * {@link OrderStatus#canTransitionTo}. Each reached status is time-stamped.</p>
 *
 * <p>The owner is stored as a plain user id so ownership checks never need to
 * load the user.</p>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_id", columnList = "userId"),
        @Index(name = "idx_order_status", columnList = "status"),
        @Index(name = "idx_order_status_created", columnList = "status, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private Long userId;

    // Short pickup code shown to the customer, e.g. "K042". Not unique.
    @Column(nullable = false, length = 4)
    private String locator;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    private String notes;

    private Integer rating;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    private LocalDateTime confirmedAt;
    private LocalDateTime preparingAt;
    private LocalDateTime readyAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime cancelledAt;

    @Builder
    public Order(Long userId, String notes) {
        this.userId = userId;
        this.notes = notes;
        this.locator = generateLocator();
        this.status = OrderStatus.CREATED;
        this.totalAmount = BigDecimal.ZERO;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void ensureModifiable() {
        if (status != OrderStatus.CREATED) {
            throw new BusinessException(ErrorCode.ORDER_NOT_MODIFIABLE,
                    "Order " + id + " is " + status + ", items can only change while CREATED");
        }
    }

    public void addItem(OrderItem item) {
        ensureModifiable();
        items.add(item);
        item.setOrder(this);
        recalculateTotal();
    }

    public OrderItem changeItemQuantity(Long itemId, int quantity) {
        ensureModifiable();
        OrderItem item = findItem(itemId);
        item.changeQuantity(quantity);
        recalculateTotal();
        return item;
    }

    public void removeItem(Long itemId) {
        ensureModifiable();
        OrderItem item = findItem(itemId);
        if (items.size() == 1) {
            throw new BusinessException(ErrorCode.EMPTY_ORDER,
                    "Cannot remove the last item of order " + id + ", cancel the order instead");
        }
        items.remove(item);
        item.setOrder(null);
        recalculateTotal();
    }

    public void updateNotes(String notes) {
        ensureModifiable();
        this.notes = notes;
    }

    public void transitionTo(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_TRANSITION,
                    "Cannot move order " + id + " from " + status + " to " + target
                            + ", allowed: " + status.nextStatuses());
        }
        this.status = target;
        stamp(target, LocalDateTime.now());
    }

    public void rate(int rating) {
        if (status != OrderStatus.DELIVERED) {
            throw new BusinessException(ErrorCode.ORDER_NOT_RATEABLE,
                    "Order " + id + " is " + status + ", only delivered orders can be rated");
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new BusinessException(ErrorCode.INVALID_RATING,
                    "Rating must be between " + MIN_RATING + " and " + MAX_RATING + " but was " + rating);
        }
        this.rating = rating;
    }

    private OrderItem findItem(Long itemId) {
        return items.stream()
                .filter(item -> itemId != null && itemId.equals(item.getId()))
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_ITEM_NOT_FOUND,
                        "Item " + itemId + " not found in order " + id));
    }

    private void stamp(OrderStatus reached, LocalDateTime at) {
        switch (reached) {
            case CONFIRMED -> this.confirmedAt = at;
            case PREPARING -> this.preparingAt = at;
            case READY -> this.readyAt = at;
            case DELIVERED -> this.deliveredAt = at;
            case CANCELLED -> this.cancelledAt = at;
            case CREATED -> throw new IllegalStateException("CREATED is never a transition target");
        }
    }

    private void recalculateTotal() {
        this.totalAmount = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String generateLocator() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        char letter = (char) ('A' + random.nextInt(26));
        return String.format("%c%03d", letter, random.nextInt(1000));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
