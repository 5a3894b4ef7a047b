package com.foodtruck.order.service;

import com.foodtruck.common.dto.DeletionOutcome;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.exception.ErrorType;
import com.foodtruck.common.security.AccessPolicy;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.order.dto.CreateOrderRequest;
import com.foodtruck.order.dto.OrderItemRequest;
import com.foodtruck.order.dto.OrderProductRating;
import com.foodtruck.order.dto.OrderResponse;
import com.foodtruck.order.dto.ProductRatingSummary;
import com.foodtruck.order.entity.Order;
import com.foodtruck.order.entity.OrderItem;
import com.foodtruck.order.entity.OrderStatus;
import com.foodtruck.order.repository.OrderRepository;
import com.foodtruck.product.entity.Product;
import com.foodtruck.product.entity.ProductCategory;
import com.foodtruck.product.service.ProductService;
import com.foodtruck.user.entity.Role;
import com.foodtruck.user.entity.User;
import com.foodtruck.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OrderServiceTest {

    private static final Long CUSTOMER_ID = 10L;
    private static final Long OTHER_CUSTOMER_ID = 11L;
    private static final Long ORDER_ID = 500L;

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private UserService userService;
    @Mock
    private ProductService productService;
    @Spy
    private AccessPolicy accessPolicy = new AccessPolicy();

    @InjectMocks
    private OrderService orderService;

    private final AuthenticatedUser admin = new AuthenticatedUser(1L, Role.ADMIN);
    private final AuthenticatedUser staff = new AuthenticatedUser(2L, Role.STAFF);
    private final AuthenticatedUser customer = new AuthenticatedUser(CUSTOMER_ID, Role.CUSTOMER);
    private final AuthenticatedUser otherCustomer = new AuthenticatedUser(OTHER_CUSTOMER_ID, Role.CUSTOMER);

    private Product burger;
    private Product lemonade;

    @BeforeEach
    void setUp() {
        burger = product(1L, "Burger", "5.00");
        lemonade = product(2L, "Lemonade", "3.50");
    }

    @Nested
    @DisplayName("createOrder")
    class CreateOrder {

        @Test
        @DisplayName("Snapshots prices and computes the total: 2 x 5.00 + 1 x 3.50 = 13.50")
        void createOrder_Success() {
            // Given
            given(userService.getActiveUser(CUSTOMER_ID)).willReturn(user(CUSTOMER_ID));
            given(productService.getOrderableProduct(1L)).willReturn(burger);
            given(productService.getOrderableProduct(2L)).willReturn(lemonade);
            given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));

            CreateOrderRequest request = new CreateOrderRequest(null, List.of(
                    new OrderItemRequest(1L, 2),
                    new OrderItemRequest(2L, 1)), "extra napkins");

            // When
            OrderResponse response = orderService.createOrder(customer, request);

            // Then
            assertThat(response.status()).isEqualTo(OrderStatus.CREATED);
            assertThat(response.totalAmount()).isEqualByComparingTo("13.50");
            assertThat(response.userId()).isEqualTo(CUSTOMER_ID);
            assertThat(response.notes()).isEqualTo("extra napkins");
            assertThat(response.items()).hasSize(2);
            assertThat(response.items().get(0).unitPrice()).isEqualByComparingTo("5.00");
            assertThat(response.items().get(0).subtotal()).isEqualByComparingTo("10.00");
        }

        @Test
        @DisplayName("Unavailable product fails validation and nothing is saved")
        void createOrder_ProductUnavailable() {
            given(userService.getActiveUser(CUSTOMER_ID)).willReturn(user(CUSTOMER_ID));
            given(productService.getOrderableProduct(3L))
                    .willThrow(new BusinessException(ErrorCode.PRODUCT_UNAVAILABLE));

            CreateOrderRequest request = new CreateOrderRequest(null, List.of(new OrderItemRequest(3L, 1)), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorType()).isEqualTo(ErrorType.VALIDATION));
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Unknown product surfaces as not found")
        void createOrder_ProductNotFound() {
            given(userService.getActiveUser(CUSTOMER_ID)).willReturn(user(CUSTOMER_ID));
            given(productService.getOrderableProduct(99L))
                    .willThrow(new BusinessException(ErrorCode.PRODUCT_NOT_FOUND));

            CreateOrderRequest request = new CreateOrderRequest(null, List.of(new OrderItemRequest(99L, 1)), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.PRODUCT_NOT_FOUND);
        }

        @Test
        void createOrder_QuantityBelowOne() {
            given(userService.getActiveUser(CUSTOMER_ID)).willReturn(user(CUSTOMER_ID));

            CreateOrderRequest request = new CreateOrderRequest(null, List.of(new OrderItemRequest(1L, 0)), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.INVALID_QUANTITY);
            verifyNoInteractions(productService);
        }

        @Test
        void createOrder_NoItems() {
            CreateOrderRequest request = new CreateOrderRequest(null, List.of(), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.EMPTY_ORDER);
        }

        @Test
        @DisplayName("Customer cannot place an order for someone else")
        void createOrder_ForOtherUserAsCustomer() {
            CreateOrderRequest request = new CreateOrderRequest(OTHER_CUSTOMER_ID,
                    List.of(new OrderItemRequest(1L, 1)), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
            verifyNoInteractions(userService, productService, orderRepository);
        }

        @Test
        @DisplayName("Staff can place an order on a customer's behalf")
        void createOrder_OnBehalfAsStaff() {
            given(userService.getActiveUser(CUSTOMER_ID)).willReturn(user(CUSTOMER_ID));
            given(productService.getOrderableProduct(1L)).willReturn(burger);
            given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));

            CreateOrderRequest request = new CreateOrderRequest(CUSTOMER_ID,
                    List.of(new OrderItemRequest(1L, 1)), null);

            OrderResponse response = orderService.createOrder(staff, request);

            ArgumentCaptor<Order> saved = ArgumentCaptor.forClass(Order.class);
            verify(orderRepository).save(saved.capture());
            assertThat(saved.getValue().getUserId()).isEqualTo(CUSTOMER_ID);
            assertThat(response.totalAmount()).isEqualByComparingTo("5.00");
        }

        @Test
        void createOrder_InactiveUser() {
            given(userService.getActiveUser(CUSTOMER_ID))
                    .willThrow(new BusinessException(ErrorCode.USER_INACTIVE));

            CreateOrderRequest request = new CreateOrderRequest(null, List.of(new OrderItemRequest(1L, 1)), null);

            assertThatThrownBy(() -> orderService.createOrder(customer, request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.USER_INACTIVE);
            verifyNoInteractions(productService);
        }
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("CREATED -> DELIVERED is an invalid transition even for admin")
        void transition_SkipToDelivered() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.transition(admin, ORDER_ID, OrderStatus.DELIVERED))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorType())
                            .isEqualTo(ErrorType.INVALID_TRANSITION));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CREATED);
        }

        @Test
        @DisplayName("Staff moves an order one step forward")
        void transition_StaffConfirms() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            OrderResponse response = orderService.transition(staff, ORDER_ID, OrderStatus.CONFIRMED);

            assertThat(response.status()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(response.confirmedAt()).isNotNull();
        }

        @Test
        @DisplayName("Customer may not advance even their own order")
        void transition_CustomerAdvances() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.transition(customer, ORDER_ID, OrderStatus.CONFIRMED))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
        }

        @Test
        @DisplayName("Staff cancels another user's PREPARING order")
        void cancel_StaffOnPreparing() {
            Order order = orderIn(OrderStatus.PREPARING, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            OrderResponse response = orderService.cancel(staff, ORDER_ID);

            assertThat(response.status()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(response.cancelledAt()).isNotNull();
        }

        @Test
        @DisplayName("Customer cannot cancel another user's PREPARING order")
        void cancel_OtherCustomerOnPreparing() {
            Order order = orderIn(OrderStatus.PREPARING, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.cancel(otherCustomer, ORDER_ID))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorType())
                            .isEqualTo(ErrorType.AUTHORIZATION));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PREPARING);
        }

        @Test
        void cancel_OwnerCancelsOwnOrder() {
            Order order = orderIn(OrderStatus.CONFIRMED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThat(orderService.cancel(customer, ORDER_ID).status()).isEqualTo(OrderStatus.CANCELLED);
        }

        @Test
        void transition_OrderNotFound() {
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.empty());

            assertThatThrownBy(() -> orderService.transition(staff, ORDER_ID, OrderStatus.CONFIRMED))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ORDER_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("line items")
    class LineItems {

        @Test
        void addItem_RecomputesTotal() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));
            given(productService.getOrderableProduct(2L)).willReturn(lemonade);

            OrderResponse response = orderService.addItem(customer, ORDER_ID, new OrderItemRequest(2L, 2));

            assertThat(response.items()).hasSize(2);
            assertThat(response.totalAmount()).isEqualByComparingTo("12.00");
            verify(orderRepository).flush();
        }

        @Test
        @DisplayName("Editing lines of a confirmed order fails with an invalid-state error")
        void addItem_AfterConfirm() {
            Order order = orderIn(OrderStatus.CONFIRMED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.addItem(customer, ORDER_ID, new OrderItemRequest(2L, 1)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorType())
                            .isEqualTo(ErrorType.INVALID_STATE));
            verifyNoInteractions(productService);
        }

        @Test
        void updateItemQuantity_OtherCustomerDenied() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.updateItemQuantity(otherCustomer, ORDER_ID, 1000L, 3))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
        }

        @Test
        void updateItemQuantity_Success() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            OrderResponse response = orderService.updateItemQuantity(customer, ORDER_ID, 1000L, 3);

            assertThat(response.totalAmount()).isEqualByComparingTo("15.00");
        }

        @Test
        void removeItem_LastLine() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.removeItem(customer, ORDER_ID, 1000L))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.EMPTY_ORDER);
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("A customer cannot read another user's order")
        void getOrder_OtherCustomer() {
            Order order = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findWithItemsById(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.getOrder(otherCustomer, ORDER_ID))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
        }

        @Test
        void getOrder_Staff() {
            Order order = orderIn(OrderStatus.READY, CUSTOMER_ID);
            given(orderRepository.findWithItemsById(ORDER_ID)).willReturn(Optional.of(order));

            assertThat(orderService.getOrder(staff, ORDER_ID).status()).isEqualTo(OrderStatus.READY);
        }

        @Test
        @DisplayName("Customer listing is always restricted to their own orders")
        void listOrders_CustomerIgnoresUserFilter() {
            Order own = orderIn(OrderStatus.CREATED, CUSTOMER_ID);
            given(orderRepository.findByUserId(eq(CUSTOMER_ID), any(Pageable.class)))
                    .willReturn(new PageImpl<>(List.of(own)));

            PageResponse<OrderResponse> page =
                    orderService.listOrders(customer, PageQuery.of(0, 20), null, OTHER_CUSTOMER_ID);

            assertThat(page.items()).extracting(OrderResponse::userId).containsOnly(CUSTOMER_ID);
            verify(orderRepository, never()).findByUserId(eq(OTHER_CUSTOMER_ID), any(Pageable.class));
        }

        @Test
        void listOrders_StaffFiltersByStatus() {
            Order ready = orderIn(OrderStatus.READY, CUSTOMER_ID);
            given(orderRepository.findByStatus(eq(OrderStatus.READY), any(Pageable.class)))
                    .willReturn(new PageImpl<>(List.of(ready)));

            PageResponse<OrderResponse> page =
                    orderService.listOrders(staff, PageQuery.of(0, 20), OrderStatus.READY, null);

            assertThat(page.items()).hasSize(1);
            assertThat(page.pagination().totalCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("rate and delete")
    class RateAndDelete {

        @Test
        void rateOrder_Delivered() {
            Order order = orderIn(OrderStatus.DELIVERED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThat(orderService.rateOrder(customer, ORDER_ID, 5).rating()).isEqualTo(5);
        }

        @Test
        void rateOrder_NotDelivered() {
            Order order = orderIn(OrderStatus.READY, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.rateOrder(customer, ORDER_ID, 5))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ORDER_NOT_RATEABLE);
        }

        @Test
        @DisplayName("Admin deletes a delivered order")
        void deleteOrder_Delivered() {
            Order order = orderIn(OrderStatus.DELIVERED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            DeletionResponse response = orderService.deleteOrder(admin, ORDER_ID);

            assertThat(response.outcome()).isEqualTo(DeletionOutcome.DELETED);
            verify(orderRepository).delete(order);
        }

        @Test
        @DisplayName("Admin cannot delete an order that is still being prepared")
        void deleteOrder_Preparing() {
            Order order = orderIn(OrderStatus.PREPARING, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.deleteOrder(admin, ORDER_ID))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorType())
                            .isEqualTo(ErrorType.INVALID_STATE));
            verify(orderRepository, never()).delete(any());
        }

        @Test
        void deleteOrder_StaffDenied() {
            Order order = orderIn(OrderStatus.DELIVERED, CUSTOMER_ID);
            given(orderRepository.findByIdForUpdate(ORDER_ID)).willReturn(Optional.of(order));

            assertThatThrownBy(() -> orderService.deleteOrder(staff, ORDER_ID))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.ACCESS_DENIED);
        }

        @Test
        @DisplayName("Each rated order counts once per product: orders rated 5 and 1 average 3.0")
        void getProductRatings_WeightsOrdersEqually() {
            given(orderRepository.findRatedOrderLinesByProduct()).willReturn(List.of(
                    new OrderProductRating(1L, "Burger", 3L, 5),
                    new OrderProductRating(1L, "Burger", 1L, 1),
                    new OrderProductRating(2L, "Lemonade", 2L, 4)));

            List<ProductRatingSummary> ratings = orderService.getProductRatings();

            assertThat(ratings).containsExactly(
                    new ProductRatingSummary(1L, "Burger", 4L, 2L, 3.0),
                    new ProductRatingSummary(2L, "Lemonade", 2L, 1L, 4.0));
        }

        @Test
        void getProductRatings_NothingRated() {
            given(orderRepository.findRatedOrderLinesByProduct()).willReturn(List.of());

            assertThat(orderService.getProductRatings()).isEmpty();
        }
    }

    /**
     * Order owned by {@code ownerId} holding one burger line (item id 1000),
     * walked forward to {@code status}.
     */
    private Order orderIn(OrderStatus status, Long ownerId) {
        Order order = Order.builder().userId(ownerId).build();
        order.addItem(OrderItem.builder().product(burger).quantity(1).build());
        ReflectionTestUtils.setField(order, "id", ORDER_ID);
        ReflectionTestUtils.setField(order.getItems().get(0), "id", 1000L);

        List<OrderStatus> path = switch (status) {
            case CREATED -> List.of();
            case CONFIRMED -> List.of(OrderStatus.CONFIRMED);
            case PREPARING -> List.of(OrderStatus.CONFIRMED, OrderStatus.PREPARING);
            case READY -> List.of(OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY);
            case DELIVERED -> List.of(OrderStatus.CONFIRMED, OrderStatus.PREPARING,
                    OrderStatus.READY, OrderStatus.DELIVERED);
            case CANCELLED -> List.of(OrderStatus.CANCELLED);
        };
        path.forEach(order::transitionTo);
        return order;
    }

    private static Product product(Long id, String name, String price) {
        Product product = Product.builder()
                .name(name)
                .price(new BigDecimal(price))
                .category(ProductCategory.FOOD)
                .build();
        ReflectionTestUtils.setField(product, "id", id);
        return product;
    }

    private static User user(Long id) {
        User user = User.builder()
                .username("customer" + id)
                .email("customer" + id + "@example.com")
                .password("hashed")
                .role(Role.CUSTOMER)
                .build();
        ReflectionTestUtils.setField(user, "id", id);
        return user;
    }
}
