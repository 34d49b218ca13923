package com.shoplytic.ai.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.exception.OperationTimeoutException;
import com.shoplytic.ai.model.ParameterSchema;
import com.shoplytic.ai.model.ToolCall;
import com.shoplytic.ai.model.ToolSpec;
import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.dto.CartItemDTO;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.dto.PurchaseResult;
import com.shoplytic.order.dto.ShippingInfoDTO;
import com.shoplytic.order.dto.ShippingInfoRequest;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.order.service.CartService;
import com.shoplytic.order.service.OrderService;
import com.shoplytic.order.service.ShippingInfoService;
import com.shoplytic.rag.dto.ProductSearchCriteria;
import com.shoplytic.rag.dto.SearchResult;
import com.shoplytic.rag.service.RetrievalException;
import com.shoplytic.rag.service.RetrievalService;
import com.shoplytic.rag.service.SearchResultFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tools of the order handler: catalog search, cart, shipping details, order
 * history and purchase.
 * <p>
 * Every tool runs on a worker thread under its own time limit. Business
 * failures and timeouts are returned as {@code Error: ...} text so the model
 * can react to them on its next step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderToolRegistry implements ToolRegistry {

    static final String AGENT = "OrderAgent";

    static final List<String> CATEGORIES = List.of("Accessories", "Clothing", "Electronics");
    static final List<String> BRANDS = List.of(
            "ASUS", "Adidas", "Allbirds", "Anker", "Apple", "Bose", "Canon", "Carhartt", "Champion", "DJI",
            "Dell", "Fossil", "Garmin", "Google", "HP", "Herschel", "JBL", "Keychron", "Levi's", "Logitech",
            "Lululemon", "Nike", "Nintendo", "Oakley", "OnePlus", "Patagonia", "Ray-Ban", "Razer", "Samsung",
            "Sony", "SteelSeries", "The North Face", "Tommy Hilfiger", "Uniqlo", "Vans");

    private final CartService cartService;
    private final ShippingInfoService shippingInfoService;
    private final OrderService orderService;
    private final RetrievalService retrievalService;
    private final TimeLimitedExecutor timeLimitedExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<ToolSpec> specs() {
        return Arrays.stream(OrderTool.values())
                .map(this::spec)
                .toList();
    }

    @Override
    public ToolExecution execute(ToolCall call, ToolContext context) {
        Optional<OrderTool> tool = OrderTool.fromName(call.name());
        if (tool.isEmpty()) {
            log.warn("Unknown order tool requested: {}", call.name());
            return ToolExecution.of("Error: Unknown function '" + call.name() + "'");
        }

        String sessionId = context.sessionId();
        log.info("Executing order tool: {} with args: {}", call.name(), call.argumentsJson());

        switch (tool.get()) {
            case SEARCH_PRODUCTS -> {
                OrderToolArgs.Search args = bind(call, OrderToolArgs.Search.class);
                return run(OrderTool.SEARCH_PRODUCTS, properties.getSearchTimeout(), () -> search(args, context));
            }
            case ADD_TO_CART -> {
                OrderToolArgs.CartLine args = bind(call, OrderToolArgs.CartLine.class);
                return text(OrderTool.ADD_TO_CART, properties.getDbTimeout(), () -> {
                    int quantity = args.quantity() == null ? 1 : args.quantity();
                    CartDTO cart = cartService.addToCart(sessionId, requireProductId(args), quantity);
                    CartItemDTO added = cart.getItems().stream()
                            .filter(item -> item.getProductId().equals(args.productId()))
                            .findFirst()
                            .orElseThrow();
                    return OrderToolMessages.added(added, cart);
                });
            }
            case EDIT_ITEM_IN_CART -> {
                OrderToolArgs.CartLine args = bind(call, OrderToolArgs.CartLine.class);
                return text(OrderTool.EDIT_ITEM_IN_CART, properties.getDbTimeout(), () -> {
                    int quantity = args.quantity() == null ? 0 : args.quantity();
                    CartDTO cart = cartService.updateQuantity(sessionId, requireProductId(args), quantity);
                    String name = cart.getItems().stream()
                            .filter(item -> item.getProductId().equals(args.productId()))
                            .map(CartItemDTO::getProductName)
                            .findFirst()
                            .orElse("Item");
                    return OrderToolMessages.updated(name, quantity, cart);
                });
            }
            case REMOVE_FROM_CART -> {
                OrderToolArgs.CartLine args = bind(call, OrderToolArgs.CartLine.class);
                return text(OrderTool.REMOVE_FROM_CART, properties.getDbTimeout(), () -> {
                    CartItemDTO removed = cartService.removeFromCart(sessionId, requireProductId(args));
                    return OrderToolMessages.removed(removed, cartService.getCart(sessionId));
                });
            }
            case VIEW_CART -> {
                return text(OrderTool.VIEW_CART, properties.getDbTimeout(),
                        () -> OrderToolMessages.cart(cartService.getCart(sessionId)));
            }
            case GET_SHIPPING_INFO -> {
                return text(OrderTool.GET_SHIPPING_INFO, properties.getDbTimeout(),
                        () -> shippingInfoService.getShippingInfo(sessionId)
                                .map(OrderToolMessages::shippingFound)
                                .orElse(OrderToolMessages.NO_SHIPPING_INFO));
            }
            case CREATE_SHIPPING_INFO -> {
                OrderToolArgs.Shipping args = bind(call, OrderToolArgs.Shipping.class);
                return text(OrderTool.CREATE_SHIPPING_INFO, properties.getDbTimeout(), () -> {
                    ShippingInfoService.SaveResult saved = shippingInfoService.saveShippingInfo(sessionId, args.data());
                    return OrderToolMessages.shippingSaved(saved.shipping(), saved.created());
                });
            }
            case EDIT_SHIPPING_INFO -> {
                OrderToolArgs.Shipping args = bind(call, OrderToolArgs.Shipping.class);
                return text(OrderTool.EDIT_SHIPPING_INFO, properties.getDbTimeout(), () -> {
                    ShippingInfoDTO shipping = shippingInfoService.updateShippingInfo(sessionId, args.data());
                    return OrderToolMessages.shippingEdited(shipping, changedFields(args.data()));
                });
            }
            case GET_ORDERS -> {
                OrderToolArgs.Orders args = bind(call, OrderToolArgs.Orders.class);
                return text(OrderTool.GET_ORDERS, properties.getOrdersTimeout(), () -> getOrders(sessionId, args.orderId()));
            }
            case PURCHASE -> {
                OrderToolArgs.Purchase args = bind(call, OrderToolArgs.Purchase.class);
                return text(OrderTool.PURCHASE, properties.getPurchaseTimeout(), () -> {
                    Optional<String> blocked = checkPurchasePreconditions(sessionId, args.voucherCode());
                    if (blocked.isPresent()) {
                        log.info("Purchase blocked before execution: sessionId={}, reason={}", sessionId, blocked.get());
                        return blocked.get();
                    }
                    PurchaseResult result = orderService.purchase(sessionId, args.voucherCode());
                    return OrderToolMessages.purchase(result);
                });
            }
        }
        throw new IllegalStateException("Unhandled order tool: " + tool.get());
    }

    @Override
    public Map<String, Object> searchParameters(ToolCall call, ToolContext context) {
        if (OrderTool.fromName(call.name()).orElse(null) != OrderTool.SEARCH_PRODUCTS) {
            return Map.of();
        }
        OrderToolArgs.Search args = bind(call, OrderToolArgs.Search.class);
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("query", searchQuery(args, context));
        if (args.category() != null && !args.category().isBlank()) {
            parameters.put("category", args.category());
        }
        if (args.brand() != null && !args.brand().isBlank()) {
            parameters.put("brand", args.brand());
        }
        if (args.minPrice() != null) {
            parameters.put("min_price", args.minPrice());
        }
        if (args.maxPrice() != null) {
            parameters.put("max_price", args.maxPrice());
        }
        if (args.featured() != null) {
            parameters.put("is_featured", args.featured());
        }
        return parameters;
    }

    /**
     * Purchase is refused up front unless the cart has items, shipping
     * details exist and a voucher code was given. A voucher that already paid
     * for an order passes, so the purchase call can report that order again.
     */
    Optional<String> checkPurchasePreconditions(String sessionId, String voucherCode) {
        if (voucherCode != null && !voucherCode.isBlank()
                && orderService.findPlacedPurchase(voucherCode).isPresent()) {
            return Optional.empty();
        }
        if (cartService.getCart(sessionId).isEmpty()) {
            return Optional.of(OrderToolMessages.error(OrderException.emptyCart().getMessage()));
        }
        if (shippingInfoService.getShippingInfo(sessionId).isEmpty()) {
            return Optional.of(OrderToolMessages.error(OrderException.shippingInfoRequired().getMessage()));
        }
        if (voucherCode == null || voucherCode.isBlank()) {
            return Optional.of(OrderToolMessages.error(OrderException.voucherRequired().getMessage()));
        }
        return Optional.empty();
    }

    private ToolExecution search(OrderToolArgs.Search args, ToolContext context) {
        int k = args.k() == null || args.k() <= 0 ? properties.getProductResults() : args.k();
        ProductSearchCriteria criteria = ProductSearchCriteria.builder()
                .query(searchQuery(args, context))
                .k(k)
                .category(blankToNull(args.category()))
                .brand(blankToNull(args.brand()))
                .minPrice(args.minPrice())
                .maxPrice(args.maxPrice())
                .featured(args.featured())
                .build();
        try {
            List<SearchResult> results = retrievalService.searchProducts(criteria, context.minSimilarity());
            return new ToolExecution(SearchResultFormatter.products(results), results);
        } catch (RetrievalException e) {
            log.error("Product search failed: {}", e.getMessage());
            return ToolExecution.of("Error: Product search is currently unavailable. Please try again later.");
        }
    }

    private String getOrders(String sessionId, Long orderId) {
        if (orderId != null) {
            try {
                OrderDTO order = orderService.getOrder(sessionId, orderId);
                return OrderToolMessages.order(order);
            } catch (OrderException e) {
                return OrderToolMessages.orderNotFound(orderId);
            }
        }
        return OrderToolMessages.recentOrders(orderService.getRecentOrders(sessionId, properties.getRecentOrders()));
    }

    private ToolExecution text(OrderTool tool, Duration timeout, Supplier<String> action) {
        return run(tool, timeout, () -> ToolExecution.of(action.get()));
    }

    private ToolExecution run(OrderTool tool, Duration timeout, Supplier<ToolExecution> action) {
        try {
            return timeLimitedExecutor.call(tool.toolName(), timeout, action);
        } catch (OperationTimeoutException e) {
            return ToolExecution.of(tool.timeoutMessage());
        } catch (OrderException e) {
            log.info("Order tool {} refused: {} [{}]", tool.toolName(), e.getMessage(), e.getErrorCode());
            return ToolExecution.of(OrderToolMessages.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Order tool {} failed: {}", tool.toolName(), e.getMessage(), e);
            return ToolExecution.of("Error: Something went wrong while running " + tool.toolName()
                    + ". Please try again.");
        }
    }

    private <T> T bind(ToolCall call, Class<T> type) {
        return ToolArguments.bind(objectMapper, AGENT, call, type);
    }

    private static Long requireProductId(OrderToolArgs.CartLine args) {
        if (args.productId() == null) {
            throw OrderException.productIdRequired();
        }
        return args.productId();
    }

    private static String searchQuery(OrderToolArgs.Search args, ToolContext context) {
        return args.query() == null || args.query().isBlank() ? context.query() : args.query();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static List<String> changedFields(ShippingInfoRequest request) {
        List<String> fields = new ArrayList<>();
        if (request.getFullName() != null) {
            fields.add("Full Name");
        }
        if (request.getAddress() != null) {
            fields.add("Address");
        }
        if (request.getCity() != null) {
            fields.add("City");
        }
        if (request.getZipCode() != null) {
            fields.add("Zip Code");
        }
        return fields;
    }

    private ToolSpec spec(OrderTool tool) {
        return switch (tool) {
            case SEARCH_PRODUCTS -> new ToolSpec(tool.toolName(),
                    "Search for products using semantic search. Extract ALL relevant filters from user queries "
                            + "(price ranges, categories, brands, featured status) and apply them. Use this tool ONLY "
                            + "when the user wants to find/browse products and not when adding to cart.",
                    ParameterSchema.object(null, searchProperties(), List.of("query")));
            case ADD_TO_CART -> new ToolSpec(tool.toolName(),
                    "Add a new product to cart. Only for products NOT already in cart. If product exists, "
                            + "use edit_item_in_cart. Check cart with view_cart first.",
                    ParameterSchema.object(null, Map.of(
                            "product_id", ParameterSchema.integer("The ID of the product to add to cart"),
                            "quantity", ParameterSchema.integer("Quantity of the product to add (default 1)")),
                            List.of("product_id")));
            case EDIT_ITEM_IN_CART -> new ToolSpec(tool.toolName(),
                    "Update quantity of item already in cart. Use when: changing quantity, adding to existing "
                            + "(new_quantity = current + X), or reducing (new_quantity = current - X). "
                            + "Check cart with view_cart first.",
                    ParameterSchema.object(null, Map.of(
                            "product_id", ParameterSchema.integer("The ID of the product in the cart to update"),
                            "quantity", ParameterSchema.integer("The new quantity for this item (must be greater than 0)")),
                            List.of("product_id", "quantity")));
            case REMOVE_FROM_CART -> new ToolSpec(tool.toolName(),
                    "Completely remove item from cart. Only for full removal. If user says 'remove X items', "
                            + "use edit_item_in_cart to reduce quantity instead.",
                    ParameterSchema.object(null, Map.of(
                            "product_id", ParameterSchema.integer("The ID of the product to remove from cart")),
                            List.of("product_id")));
            case VIEW_CART -> new ToolSpec(tool.toolName(),
                    "View cart contents with quantities, prices, and total. Always call this to get current cart "
                            + "state - do not describe from memory.",
                    ParameterSchema.empty());
            case GET_SHIPPING_INFO -> new ToolSpec(tool.toolName(),
                    "Check if shipping information exists. Call when user asks about shipping info or before purchase.",
                    ParameterSchema.empty());
            case CREATE_SHIPPING_INFO -> new ToolSpec(tool.toolName(),
                    "Create shipping information. Extract fullName, address, city, zipCode from user message. "
                            + "All fields required. Call this tool to save, don't just acknowledge.",
                    ParameterSchema.object(null, Map.of("shipping_data", ParameterSchema.object(
                            "Extracted shipping information as JSON object with fields: fullName, address, city, zipCode",
                            shippingProperties(""),
                            List.of("fullName", "address", "city", "zipCode"))),
                            List.of("shipping_data")));
            case EDIT_SHIPPING_INFO -> new ToolSpec(tool.toolName(),
                    "Update existing shipping information. Extract only fields to change (fullName, address, city, "
                            + "zipCode). Partial updates allowed. Call this tool to save changes.",
                    ParameterSchema.object(null, Map.of("shipping_data", ParameterSchema.object(
                            "Updated shipping information. Include only the fields the user wants to update.",
                            shippingProperties(" (only include if user wants to update this)"),
                            List.of())),
                            List.of("shipping_data")));
            case GET_ORDERS -> new ToolSpec(tool.toolName(),
                    "Get order information. If order_id provided, returns that order. Otherwise returns "
                            + properties.getRecentOrders() + " most recent orders. Always call this to get current state.",
                    ParameterSchema.object(null, Map.of(
                            "order_id", ParameterSchema.integer("Optional order ID of a specific order")),
                            List.of()));
            case PURCHASE -> new ToolSpec(tool.toolName(),
                    "Complete purchase with voucher code. Call ONCE when user provides voucher code. Call immediately "
                            + "without confirmation messages. Requires: items in cart, shipping info, and valid voucher code.",
                    ParameterSchema.object(null, Map.of(
                            "voucher_code", ParameterSchema.string("The voucher code to use for payment")),
                            List.of("voucher_code")));
        };
    }

    private Map<String, ParameterSchema> searchProperties() {
        Map<String, ParameterSchema> properties = new LinkedHashMap<>();
        properties.put("query", ParameterSchema.string(
                "The search query describing what the user is looking for."));
        properties.put("k", ParameterSchema.integer(
                "Number of results to return (default " + this.properties.getProductResults() + ")"));
        properties.put("category", ParameterSchema.oneOf(
                "Optional category filter (e.g., 'laptops'/'phones'/'watches' → 'Electronics', "
                        + "'shoes'/'clothes' → 'Clothing', 'headphones' → 'Accessories').", CATEGORIES));
        properties.put("brand", ParameterSchema.oneOf(
                "Optional brand filter. Only when the user mentions a specific brand.", BRANDS));
        properties.put("max_price", ParameterSchema.number(
                "Optional maximum price, from phrases like 'below $50', 'under $100', 'cheap', 'budget'."));
        properties.put("min_price", ParameterSchema.number(
                "Optional minimum price, from phrases like 'above $50', 'over $100', 'premium', 'high-end'."));
        properties.put("is_featured", ParameterSchema.bool(
                "Set to true if user asks for featured products, popular items, best sellers or trending products."));
        return properties;
    }

    private static Map<String, ParameterSchema> shippingProperties(String suffix) {
        Map<String, ParameterSchema> properties = new LinkedHashMap<>();
        properties.put("fullName", ParameterSchema.string("Full name for shipping" + suffix));
        properties.put("address", ParameterSchema.string("Complete street address" + suffix));
        properties.put("city", ParameterSchema.string("City name" + suffix));
        properties.put("zipCode", ParameterSchema.string("Zip/postal code" + suffix));
        return properties;
    }
}
