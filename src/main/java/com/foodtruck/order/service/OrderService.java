package com.foodtruck.order.service;

import com.foodtruck.common.dto.DeletionOutcome;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.security.AccessAction;
import com.foodtruck.common.security.AccessPolicy;
import com.foodtruck.common.security.AccessResource;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.order.dto.*;
import com.foodtruck.order.entity.Order;
import com.foodtruck.order.entity.OrderItem;
import com.foodtruck.order.entity.OrderStatus;
import com.foodtruck.order.repository.OrderRepository;
import com.foodtruck.product.entity.Product;
import com.foodtruck.product.service.ProductService;
import com.foodtruck.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.foodtruck.common.security.AccessAction.*;

/**
 * Order workflow: creation with price snapshots, line-item edits while the
 * order is still CREATED, status transitions, rating and deletion.
 *
 * <p>Every write loads the order with {@code SELECT ... FOR UPDATE} so two
 * requests against the same order are applied one after the other. Checks run
 * in a fixed order: existence, then the access gate, then the state rules.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderService {

    private final OrderRepository orderRepository;
    private final UserService userService;
    private final ProductService productService;
    private final AccessPolicy accessPolicy;

    @Transactional
    public OrderResponse createOrder(AuthenticatedUser actor, CreateOrderRequest request) {
        Long ownerId = request.userId() != null ? request.userId() : actor.userId();
        accessPolicy.check(actor, AccessResource.ORDER, CREATE, actor.owns(ownerId));

        if (request.items() == null || request.items().isEmpty()) {
            throw new BusinessException(ErrorCode.EMPTY_ORDER);
        }
        userService.getActiveUser(ownerId);

        log.info("Creating order: userId={}, actorId={}, lines={}",
                ownerId, actor.userId(), request.items().size());

        Order order = Order.builder()
                .userId(ownerId)
                .notes(request.notes())
                .build();
        for (OrderItemRequest line : request.items()) {
            order.addItem(snapshot(line));
        }

        order = orderRepository.save(order);
        log.info("Order created: orderId={}, locator={}, total={}",
                order.getId(), order.getLocator(), order.getTotalAmount());
        return OrderResponse.from(order);
    }

    public OrderResponse getOrder(AuthenticatedUser actor, Long id) {
        return OrderResponse.from(findReadableOrder(actor, id));
    }

    public List<OrderItemResponse> getOrderItems(AuthenticatedUser actor, Long id) {
        return findReadableOrder(actor, id).getItems().stream()
                .map(OrderItemResponse::from)
                .toList();
    }

    /**
     * Staff and admin see every order and may filter by owner. Everyone else
     * sees only their own orders; a {@code userId} filter naming someone else
     * is ignored.
     */
    public PageResponse<OrderResponse> listOrders(AuthenticatedUser actor, PageQuery page,
                                                  OrderStatus status, Long userId) {
        Long ownerFilter;
        if (accessPolicy.hasUnrestrictedAccess(actor.role(), AccessResource.ORDER, READ)) {
            ownerFilter = userId;
        } else {
            accessPolicy.check(actor, AccessResource.ORDER, READ, true);
            ownerFilter = actor.userId();
        }

        Pageable pageable = page.toPageable(Sort.by(Sort.Direction.DESC, "id"));
        Page<Order> orders;
        if (ownerFilter != null && status != null) {
            orders = orderRepository.findByUserIdAndStatus(ownerFilter, status, pageable);
        } else if (ownerFilter != null) {
            orders = orderRepository.findByUserId(ownerFilter, pageable);
        } else if (status != null) {
            orders = orderRepository.findByStatus(status, pageable);
        } else {
            orders = orderRepository.findAll(pageable);
        }
        return PageResponse.of(orders, page, OrderResponse::from);
    }

    /**
     * Moving to CANCELLED needs the CANCEL permission, any other target needs
     * ADVANCE. Legality of the move itself is decided by {@link OrderStatus}.
     */
    @Transactional
    public OrderResponse transition(AuthenticatedUser actor, Long id, OrderStatus target) {
        Order order = findOrderForUpdate(id);
        AccessAction action = target == OrderStatus.CANCELLED ? CANCEL : ADVANCE;
        accessPolicy.check(actor, AccessResource.ORDER, action, order.isOwnedBy(actor.userId()));

        OrderStatus previous = order.getStatus();
        order.transitionTo(target);
        log.info("Order status changed: orderId={}, {} -> {}, actorId={}",
                id, previous, target, actor.userId());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse cancel(AuthenticatedUser actor, Long id) {
        return transition(actor, id, OrderStatus.CANCELLED);
    }

    @Transactional
    public OrderResponse addItem(AuthenticatedUser actor, Long id, OrderItemRequest request) {
        Order order = findModifiableOrder(actor, id);
        order.addItem(snapshot(request));
        // assigns the new line its id before it is returned
        orderRepository.flush();
        log.info("Order item added: orderId={}, productId={}, quantity={}, total={}",
                id, request.productId(), request.quantity(), order.getTotalAmount());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse updateItemQuantity(AuthenticatedUser actor, Long id, Long itemId, int quantity) {
        Order order = findModifiableOrder(actor, id);
        order.changeItemQuantity(itemId, quantity);
        log.info("Order item quantity changed: orderId={}, itemId={}, quantity={}, total={}",
                id, itemId, quantity, order.getTotalAmount());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse removeItem(AuthenticatedUser actor, Long id, Long itemId) {
        Order order = findModifiableOrder(actor, id);
        order.removeItem(itemId);
        log.info("Order item removed: orderId={}, itemId={}, total={}", id, itemId, order.getTotalAmount());
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse updateNotes(AuthenticatedUser actor, Long id, String notes) {
        Order order = findModifiableOrder(actor, id);
        order.updateNotes(notes);
        return OrderResponse.from(order);
    }

    @Transactional
    public OrderResponse rateOrder(AuthenticatedUser actor, Long id, int rating) {
        Order order = findOrderForUpdate(id);
        accessPolicy.check(actor, AccessResource.ORDER, RATE, order.isOwnedBy(actor.userId()));
        order.rate(rating);
        log.info("Order rated: orderId={}, rating={}", id, rating);
        return OrderResponse.from(order);
    }

    /**
     * Only finished orders (DELIVERED or CANCELLED) can be removed.
     */
    @Transactional
    public DeletionResponse deleteOrder(AuthenticatedUser actor, Long id) {
        Order order = findOrderForUpdate(id);
        accessPolicy.check(actor, AccessResource.ORDER, DELETE, order.isOwnedBy(actor.userId()));
        if (!order.isTerminal()) {
            throw new BusinessException(ErrorCode.ORDER_NOT_DELETABLE,
                    "Order " + id + " is " + order.getStatus() + ", only delivered or cancelled orders can be deleted");
        }

        orderRepository.delete(order);
        log.info("Order deleted: orderId={}, status={}", id, order.getStatus());
        return new DeletionResponse(id, DeletionOutcome.DELETED);
    }

    /**
     * Ratings per product, ordered by product id. Every rated order counts
     * once per product it contains.
     */
    public List<ProductRatingSummary> getProductRatings() {
        Map<Long, List<OrderProductRating>> byProduct = orderRepository.findRatedOrderLinesByProduct().stream()
                .collect(Collectors.groupingBy(OrderProductRating::productId, TreeMap::new, Collectors.toList()));
        return byProduct.values().stream()
                .map(ProductRatingSummary::of)
                .toList();
    }

    private OrderItem snapshot(OrderItemRequest line) {
        int quantity = line.quantity() == null ? 0 : line.quantity();
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY,
                    "Quantity must be at least 1 but was " + quantity);
        }
        Product product = productService.getOrderableProduct(line.productId());
        return OrderItem.builder()
                .product(product)
                .quantity(quantity)
                .build();
    }

    private Order findReadableOrder(AuthenticatedUser actor, Long id) {
        Order order = orderRepository.findWithItemsById(id)
                .orElseThrow(() -> orderNotFound(id));
        accessPolicy.check(actor, AccessResource.ORDER, READ, order.isOwnedBy(actor.userId()));
        return order;
    }

    private Order findModifiableOrder(AuthenticatedUser actor, Long id) {
        Order order = findOrderForUpdate(id);
        accessPolicy.check(actor, AccessResource.ORDER, UPDATE, order.isOwnedBy(actor.userId()));
        order.ensureModifiable();
        return order;
    }

    private Order findOrderForUpdate(Long id) {
        return orderRepository.findByIdForUpdate(id)
                .orElseThrow(() -> orderNotFound(id));
    }

    private static BusinessException orderNotFound(Long id) {
        return new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order " + id + " not found");
    }
}
