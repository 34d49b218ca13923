package com.shoplytic.ai.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shoplytic.order.dto.ShippingInfoRequest;

/**
 * Argument shapes of the order handler's tools, as the model sends them.
 */
final class OrderToolArgs {

    private OrderToolArgs() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Search(
            @JsonProperty("query") String query,
            @JsonProperty("k") Integer k,
            @JsonProperty("category") String category,
            @JsonProperty("brand") String brand,
            @JsonProperty("min_price") Double minPrice,
            @JsonProperty("max_price") Double maxPrice,
            @JsonProperty("is_featured") Boolean featured) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CartLine(
            @JsonProperty("product_id") Long productId,
            @JsonProperty("quantity") Integer quantity) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Shipping(@JsonProperty("shipping_data") ShippingInfoRequest shippingData) {

        ShippingInfoRequest data() {
            return shippingData == null ? new ShippingInfoRequest() : shippingData;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Orders(@JsonProperty("order_id") Long orderId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Purchase(@JsonProperty("voucher_code") String voucherCode) {
    }
}
