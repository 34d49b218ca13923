package com.shoplytic.ai.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoplytic.ai.concurrent.TimeLimitedExecutor;
import com.shoplytic.ai.config.AgentProperties;
import com.shoplytic.ai.model.ChatMessage;
import com.shoplytic.ai.model.ModelProvider;
import com.shoplytic.ai.tool.OrderToolRegistry;
import com.shoplytic.ai.tool.ToolContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Product search, cart, shipping details, order history and purchase.
 * <p>
 * Sees the earlier conversation, including the product ids of previous
 * searches, so follow-ups like "add the second one" can be resolved.
 */
@Slf4j
@Component
public class OrderAgent implements SubAgent {

    static final String SYSTEM_PROMPT =
            "You are Shoplytic's Order Agent. Decide the SINGLE NEXT ACTION per turn.\n\n"
                    + "RULES:\n"
                    + "- Call exactly ONE tool OR ask for missing info\n"
                    + "- Never call multiple tools or perform actions without tools\n"
                    + "- Never assume state, always check with tools\n"
                    + "- Never calculate cart totals yourself, use view_cart\n\n"
                    + "Shopping flow: Search → Add to cart → View cart → Shipping info → Purchase\n\n"
                    + "Cart quantities:\n"
                    + "- 'add X items' to existing: edit_item_in_cart (new_quantity = current + X)\n"
                    + "- 'remove X items': edit_item_in_cart (new_quantity = current - X)\n"
                    + "- Complete removal: remove_from_cart\n"
                    + "- Always check cart with view_cart first\n\n"
                    + "Tools:\n"
                    + "- search_products: Find products. Filters: price (below/cheap → max_price, above/premium → "
                    + "min_price), category (laptops/phones/watches → Electronics, shoes/clothes → Clothing, "
                    + "headphones → Accessories), brand, featured\n"
                    + "- add_to_cart: Add new product (product_id, optional quantity). Only for items NOT in cart\n"
                    + "- view_cart: Check cart contents\n"
                    + "- edit_item_in_cart: Update quantity\n"
                    + "- remove_from_cart: Complete removal only\n"
                    + "- get_shipping_info: Check if shipping info exists\n"
                    + "- create_shipping_info: Create (requires fullName, address, city, zipCode)\n"
                    + "- edit_shipping_info: Update shipping info\n"
                    + "- get_orders: Get orders (optional order_id, else 5 most recent)\n"
                    + "- purchase: Complete purchase (requires voucher_code)";

    private final ToolLoop toolLoop;

    public OrderAgent(ModelProvider modelProvider, OrderToolRegistry toolRegistry,
                      TimeLimitedExecutor timeLimitedExecutor, AgentProperties properties,
                      ObjectMapper objectMapper) {
        this.toolLoop = new ToolLoop("OrderAgent", modelProvider, toolRegistry,
                timeLimitedExecutor, properties, objectMapper);
    }

    @Override
    public AgentType type() {
        return AgentType.ORDER;
    }

    @Override
    public AgentResult invoke(String query, String sessionId, List<ChatMessage> history, double minSimilarity) {
        log.info("Order agent invoked: query='{}'", query);
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(SYSTEM_PROMPT));
        messages.addAll(history);
        messages.add(ChatMessage.user(query));
        return toolLoop.run(messages, new ToolContext(sessionId, query, minSimilarity));
    }
}
