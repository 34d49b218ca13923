package com.shoplytic.ai.tool;

import com.shoplytic.common.util.Money;
import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.dto.CartItemDTO;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.dto.OrderItemDTO;
import com.shoplytic.order.dto.PurchaseResult;
import com.shoplytic.order.dto.ShippingInfoDTO;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result texts of the order tools.
 */
final class OrderToolMessages {

    static final String EMPTY_CART = "Your cart is empty. Add items to your cart to get started!";
    static final String NO_SHIPPING_INFO = "No shipping information found. "
            + "Please provide your shipping details (full name, address, city, zip code) before completing your purchase.";
    static final String NO_ORDERS = "You have no orders yet. Start shopping to create your first order!";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private OrderToolMessages() {
    }

    static String error(String message) {
        return "Error: " + message;
    }

    static String added(CartItemDTO item, CartDTO cart) {
        return String.format("Added %dx %s to cart. Cart total: %s",
                item.getQuantity(), item.getProductName(), cart.getFormattedTotal());
    }

    static String updated(String productName, int quantity, CartDTO cart) {
        return String.format("Updated %s quantity to %d. Cart total: %s", productName, quantity, cart.getFormattedTotal());
    }

    static String removed(CartItemDTO item, CartDTO cart) {
        return String.format("Removed %s from cart. Cart total: %s", item.getProductName(), cart.getFormattedTotal());
    }

    static String cart(CartDTO cart) {
        if (cart.isEmpty()) {
            return EMPTY_CART;
        }
        List<String> lines = new ArrayList<>();
        lines.add("Your Shopping Cart:");
        lines.add("");
        for (CartItemDTO item : cart.getItems()) {
            lines.add(String.format("• %s (ID: %d)\n  Quantity: %d × %s = %s",
                    item.getProductName(), item.getProductId(), item.getQuantity(),
                    Money.format(item.getUnitPrice()), Money.format(item.getSubtotal())));
        }
        lines.add("");
        lines.add("Total: " + cart.getFormattedTotal());
        lines.add("Items in cart: " + cart.getTotalItems());
        return String.join("\n", lines);
    }

    static String shippingFound(ShippingInfoDTO shipping) {
        return "Shipping information found:\n"
                + shippingFields(shipping)
                + "\nYou can proceed with purchase using a voucher code.";
    }

    static String shippingSaved(ShippingInfoDTO shipping, boolean created) {
        String headline = created
                ? "Shipping information saved successfully!"
                : "Shipping information updated successfully!";
        return headline + "\n"
                + shippingFields(shipping)
                + "\nYou can now proceed with purchase using a voucher code.";
    }

    static String shippingEdited(ShippingInfoDTO shipping, List<String> updatedFields) {
        return "Shipping information updated successfully! Updated fields: " + String.join(", ", updatedFields) + "\n"
                + shippingFields(shipping)
                + "\nYou can now proceed with purchase using a voucher code.";
    }

    private static String shippingFields(ShippingInfoDTO shipping) {
        return "Full Name: " + shipping.getFullName() + "\n"
                + "Address: " + shipping.getAddress() + "\n"
                + "City: " + shipping.getCity() + "\n"
                + "Zip Code: " + shipping.getZipCode() + "\n";
    }

    static String order(OrderDTO order) {
        List<String> lines = new ArrayList<>();
        lines.add("Order #" + order.getId());
        lines.add("Status: " + order.getStatus());
        lines.add("Total: " + Money.format(order.getTotalAmount()));
        lines.add("Voucher Code: " + voucher(order));
        lines.add("Created: " + timestamp(order.getCreatedAt()));
        lines.add("");
        lines.add("Items:");
        for (OrderItemDTO item : order.getItems()) {
            lines.add(String.format("  • %s (Product ID: %d)\n    Quantity: %d × %s = %s",
                    item.getProductName(), item.getProductId(), item.getQuantity(),
                    Money.format(item.getUnitPrice()), Money.format(item.getSubtotal())));
        }
        return String.join("\n", lines);
    }

    static String recentOrders(List<OrderDTO> orders) {
        if (orders.isEmpty()) {
            return NO_ORDERS;
        }
        List<String> lines = new ArrayList<>();
        lines.add(String.format("Your %d Most Recent Orders:", orders.size()));
        lines.add("");
        for (OrderDTO order : orders) {
            lines.add("Order #" + order.getId() + " - " + order.getStatus().toUpperCase() + "\n"
                    + "Total: " + Money.format(order.getTotalAmount()) + "\n"
                    + "Voucher: " + voucher(order) + "\n"
                    + "Date: " + timestamp(order.getCreatedAt()) + "\n"
                    + "Items (" + order.getItems().size() + "):");
            order.getItems().forEach(item -> lines.add(itemLine(item)));
            lines.add("");
        }
        return String.join("\n", lines);
    }

    static String orderNotFound(Long orderId) {
        return String.format("Error: Order ID %d not found or does not belong to your session.", orderId);
    }

    static String purchase(PurchaseResult result) {
        OrderDTO order = result.order();
        if (result.alreadyPlaced()) {
            return "✅ Your purchase has already been placed. Order ID: " + order.getId();
        }

        ShippingInfoDTO shipping = result.shipping();
        String items = order.getItems().stream()
                .map(OrderToolMessages::itemLine)
                .collect(Collectors.joining("\n"));

        return "✅ Purchase completed successfully! Your order has been placed and saved.\n\n"
                + "Order Details:\n"
                + "  Order ID: " + order.getId() + "\n"
                + "  Status: " + order.getStatus() + "\n"
                + "  Total Amount: " + Money.format(order.getTotalAmount()) + "\n"
                + "  Voucher Code Used: " + order.getVoucherCode() + "\n"
                + "  Remaining Voucher Balance: " + Money.format(result.remainingVoucherBalance()) + "\n"
                + "\nOrder Items:\n" + items + "\n"
                + "\nShipping Address:\n"
                + "  " + shipping.getFullName() + "\n"
                + "  " + shipping.getAddress() + "\n"
                + "  " + shipping.getCity() + ", " + shipping.getZipCode() + "\n"
                + "\nOrder Date: " + timestamp(order.getCreatedAt()) + "\n"
                + "\nThank you for your purchase! Your order is confirmed and will be processed shortly.";
    }

    private static String itemLine(OrderItemDTO item) {
        return String.format("  • %s (Qty: %d) - %s",
                item.getProductName(), item.getQuantity(), Money.format(item.getSubtotal()));
    }

    private static String voucher(OrderDTO order) {
        return order.getVoucherCode() == null ? "None" : order.getVoucherCode();
    }

    private static String timestamp(LocalDateTime value) {
        return value == null ? "N/A" : TIMESTAMP.format(value);
    }
}
