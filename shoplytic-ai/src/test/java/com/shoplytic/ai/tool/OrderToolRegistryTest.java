package com.shoplytic.ai.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.AgentProtocolException;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.dto.CartItemDTO;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.dto.PurchaseResult;
import com.shoplytic.order.dto.ShippingInfoDTO;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.order.service.CartService;
import com.shoplytic.order.service.OrderService;
import com.shoplytic.order.service.ShippingInfoService;
import com.shoplytic.rag.dto.ProductSearchCriteria;
import com.shoplytic.rag.dto.SearchResult;
import com.shoplytic.rag.service.RetrievalException;
import com.shoplytic.rag.service.RetrievalService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderToolRegistryTest {

    private static final String SESSION = "session_0123456789abcdef";
    private static final ToolContext CONTEXT = new ToolContext(SESSION, "something warm", 0.7);

    @Mock
    private CartService cartService;

    @Mock
    private ShippingInfoService shippingInfoService;

    @Mock
    private OrderService orderService;

    @Mock
    private RetrievalService retrievalService;

    private ExecutorService executor;
    private AgentProperties properties;
    private OrderToolRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        properties = new AgentProperties();
        registry = new OrderToolRegistry(cartService, shippingInfoService, orderService, retrievalService,
                new TimeLimitedExecutor(executor), properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ToolCall call(String name, String args) {
        return new ToolCall("call_1", name, args);
    }

    private static CartItemDTO hoodie(int quantity) {
        return CartItemDTO.builder()
                .productId(7L)
                .productName("Nike Club Hoodie")
                .quantity(quantity)
                .unitPrice(new BigDecimal("45.00"))
                .build();
    }

    private static ShippingInfoDTO shipping() {
        return ShippingInfoDTO.builder()
                .fullName("Ada Lovelace")
                .address("12 Analytical Way")
                .city("London")
                .zipCode("N1 9GU")
                .build();
    }

    private static OrderDTO order(long id) {
        return OrderDTO.builder()
                .id(id)
                .sessionId(SESSION)
                .voucherCode("VOUCHER-ABC")
                .status("completed")
                .totalAmount(new BigDecimal("90.00"))
                .items(List.of())
                .createdAt(LocalDateTime.of(2026, 3, 1, 10, 30))
                .build();
    }

    @Test
    void everyToolIsDeclared() {
        assertThat(registry.specs()).hasSize(OrderTool.values().length);
    }

    @Test
    void unknownToolIsReportedToTheModel() {
        ToolExecution execution = registry.execute(call("teleport", "{}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: Unknown function 'teleport'");
    }

    @Test
    void addToCartReportsTheNewTotal() {
        when(cartService.addToCart(SESSION, 7L, 2)).thenReturn(CartDTO.of(SESSION, List.of(hoodie(2))));

        ToolExecution execution = registry.execute(call("add_to_cart", "{\"product_id\":7,\"quantity\":2}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Added 2x Nike Club Hoodie to cart. Cart total: $90.00");
    }

    @Test
    void addingAnItemAlreadyInTheCartPointsToEdit() {
        when(cartService.addToCart(SESSION, 7L, 1)).thenThrow(OrderException.itemAlreadyInCart("Nike Club Hoodie"));

        ToolExecution execution = registry.execute(call("add_to_cart", "{\"product_id\":7}"), CONTEXT);

        assertThat(execution.result()).isEqualTo(
                "Error: Nike Club Hoodie is already in your cart. Use edit_item_in_cart to update the quantity.");
    }

    @Test
    void missingProductIdIsRefused() {
        ToolExecution execution = registry.execute(call("remove_from_cart", "{}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: " + OrderException.productIdRequired().getMessage());
    }

    @Test
    void emptyCartIsDescribed() {
        when(cartService.getCart(SESSION)).thenReturn(CartDTO.of(SESSION, List.of()));

        ToolExecution execution = registry.execute(call("view_cart", "{}"), CONTEXT);

        assertThat(execution.result()).isEqualTo(OrderToolMessages.EMPTY_CART);
    }

    @Test
    void slowDatabaseCallReturnsTheToolsTimeoutMessage() {
        properties.setDbTimeout(Duration.ofMillis(50));
        when(cartService.getCart(SESSION)).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return CartDTO.of(SESSION, List.of());
        });

        ToolExecution execution = registry.execute(call("view_cart", "{}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: Viewing cart timed out. Please try again.");
    }

    @Test
    void purchaseWithEmptyCartIsBlockedBeforeTouchingTheVoucher() {
        when(orderService.findPlacedPurchase("VOUCHER-ABC")).thenReturn(Optional.empty());
        when(cartService.getCart(SESSION)).thenReturn(CartDTO.of(SESSION, List.of()));

        ToolExecution execution = registry.execute(call("purchase", "{\"voucher_code\":\"VOUCHER-ABC\"}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: " + OrderException.emptyCart().getMessage());
        verify(orderService, never()).purchase(anyString(), anyString());
    }

    @Test
    void purchaseWithoutShippingDetailsIsBlocked() {
        when(orderService.findPlacedPurchase("VOUCHER-ABC")).thenReturn(Optional.empty());
        when(cartService.getCart(SESSION)).thenReturn(CartDTO.of(SESSION, List.of(hoodie(1))));
        when(shippingInfoService.getShippingInfo(SESSION)).thenReturn(Optional.empty());

        ToolExecution execution = registry.execute(call("purchase", "{\"voucher_code\":\"VOUCHER-ABC\"}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: " + OrderException.shippingInfoRequired().getMessage());
        verify(orderService, never()).purchase(anyString(), anyString());
    }

    @Test
    void purchaseWithoutVoucherIsBlocked() {
        when(cartService.getCart(SESSION)).thenReturn(CartDTO.of(SESSION, List.of(hoodie(1))));
        when(shippingInfoService.getShippingInfo(SESSION)).thenReturn(Optional.of(shipping()));

        ToolExecution execution = registry.execute(call("purchase", "{\"voucher_code\":\"  \"}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("Error: " + OrderException.voucherRequired().getMessage());
        verify(orderService, never()).purchase(anyString(), anyString());
    }

    @Test
    @DisplayName("Repeating a completed purchase reports the existing order even though the cart is now empty")
    void repeatedPurchaseReportsTheExistingOrder() {
        PurchaseResult replay = PurchaseResult.replay(order(12));
        when(orderService.findPlacedPurchase("VOUCHER-ABC")).thenReturn(Optional.of(replay));
        when(orderService.purchase(SESSION, "VOUCHER-ABC")).thenReturn(replay);

        ToolExecution execution = registry.execute(call("purchase", "{\"voucher_code\":\"VOUCHER-ABC\"}"), CONTEXT);

        assertThat(execution.result()).isEqualTo("✅ Your purchase has already been placed. Order ID: 12");
        verify(cartService, never()).getCart(anyString());
    }

    @Test
    void unknownOrderIdIsReportedAsNotFound() {
        when(orderService.getOrder(SESSION, 99L)).thenThrow(OrderException.orderNotFound(99L));

        ToolExecution execution = registry.execute(call("get_orders", "{\"order_id\":99}"), CONTEXT);

        assertThat(execution.result())
                .isEqualTo("Error: Order ID 99 not found or does not belong to your session.");
    }

    @Test
    void searchUsesDefaultResultCountAndReturnsSources() {
        SearchResult result = SearchResult.builder()
                .id("p7")
                .content("Warm fleece hoodie")
                .metadata(Map.of("product_id", 7, "brand", "Nike", "category", "Clothing", "price", 45.0))
                .similarity(0.82)
                .build();
        when(retrievalService.searchProducts(any(ProductSearchCriteria.class), eq(0.7))).thenReturn(List.of(result));

        ToolExecution execution = registry.execute(
                call("search_products", "{\"query\":\"hoodie\",\"max_price\":50}"), CONTEXT);

        ArgumentCaptor<ProductSearchCriteria> criteria = ArgumentCaptor.forClass(ProductSearchCriteria.class);
        verify(retrievalService).searchProducts(criteria.capture(), anyDouble());
        assertThat(criteria.getValue().getK()).isEqualTo(5);
        assertThat(criteria.getValue().getMaxPrice()).isEqualTo(50.0);
        assertThat(execution.sources()).containsExactly(result);
        assertThat(execution.result()).contains("Product ID: 7");
    }

    @Test
    void searchOutageIsReportedToTheModel() {
        when(retrievalService.searchProducts(any(ProductSearchCriteria.class), anyDouble()))
                .thenThrow(new RetrievalException("index unavailable"));

        ToolExecution execution = registry.execute(call("search_products", "{\"query\":\"hoodie\"}"), CONTEXT);

        assertThat(execution.result())
                .isEqualTo("Error: Product search is currently unavailable. Please try again later.");
    }

    @Test
    void searchParametersEchoOnlyWhatTheModelSet() {
        Map<String, Object> parameters = registry.searchParameters(
                call("search_products", "{\"query\":\"hoodie\",\"brand\":\"\",\"max_price\":50}"), CONTEXT);

        assertThat(parameters).containsExactly(Map.entry("query", "hoodie"), Map.entry("max_price", 50.0));
    }

    @Test
    void searchWithoutQueryFallsBackToTheHandlerQuery() {
        Map<String, Object> parameters = registry.searchParameters(
                call("search_products", "{\"is_featured\":true}"), CONTEXT);

        assertThat(parameters).containsEntry("query", "something warm").containsEntry("is_featured", true);
    }

    @Test
    void nonSearchToolsHaveNoSearchParameters() {
        assertThat(registry.searchParameters(call("view_cart", "{}"), CONTEXT)).isEmpty();
    }

    @Test
    void argumentsOfTheWrongShapeAreAProtocolViolation() {
        assertThatThrownBy(() -> registry.execute(call("add_to_cart", "{\"product_id\":\"seven\"}"), CONTEXT))
                .isInstanceOf(AgentProtocolException.class);
    }
}
