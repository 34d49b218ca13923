package com.shoplytic.ai.tool;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operations available to the order handler.
 */
public enum OrderTool {

    SEARCH_PRODUCTS("search_products", "Error: Product search timed out. Please try again."),
    ADD_TO_CART("add_to_cart", "Error: Adding to cart timed out. Please try again."),
    EDIT_ITEM_IN_CART("edit_item_in_cart", "Error: Updating cart item timed out. Please try again."),
    REMOVE_FROM_CART("remove_from_cart", "Error: Removing item from cart timed out. Please try again."),
    VIEW_CART("view_cart", "Error: Viewing cart timed out. Please try again."),
    GET_SHIPPING_INFO("get_shipping_info", "Error: Retrieving shipping information timed out. Please try again."),
    CREATE_SHIPPING_INFO("create_shipping_info", "Error: Saving shipping information timed out. Please try again."),
    EDIT_SHIPPING_INFO("edit_shipping_info", "Error: Updating shipping information timed out. Please try again."),
    GET_ORDERS("get_orders", "Error: Retrieving orders timed out. Please try again."),
    PURCHASE("purchase", "Error: Processing purchase timed out. Please try again.");

    private final String toolName;
    private final String timeoutMessage;

    OrderTool(String toolName, String timeoutMessage) {
        this.toolName = toolName;
        this.timeoutMessage = timeoutMessage;
    }

    public String toolName() {
        return toolName;
    }

    public String timeoutMessage() {
        return timeoutMessage;
    }

    public static Optional<OrderTool> fromName(String name) {
        return Arrays.stream(values())
                .filter(tool -> tool.toolName.equals(name))
                .findFirst();
    }
}
