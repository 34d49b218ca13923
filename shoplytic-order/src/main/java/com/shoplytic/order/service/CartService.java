package com.shoplytic.order.service;

import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.dto.CartItemDTO;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.product.dto.ProductDTO;
import com.shoplytic.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cart store, keyed by session.
 * <p>
 * Each session owns its own cart and lock, so operations for different
 * sessions never contend. Within a session a product appears at most once;
 * mutations and snapshots are atomic with respect to each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final ProductService productService;
    private final Map<String, SessionCart> carts = new ConcurrentHashMap<>();

    public CartDTO getCart(String sessionId) {
        return cartFor(sessionId).snapshot(sessionId);
    }

    /**
     * Adds a new line. Rejects products that are unknown, inactive, short on
     * stock or already present in the cart.
     */
    public CartDTO addToCart(String sessionId, Long productId, int quantity) {
        if (quantity <= 0) {
            throw OrderException.invalidQuantity();
        }

        ProductDTO product = productService.findProduct(productId)
                .orElseThrow(() -> OrderException.productNotFound(productId));

        if (!product.isPurchasable()) {
            throw OrderException.productNotAvailable(product.getName());
        }

        int available = product.getStockQuantity() == null ? 0 : product.getStockQuantity();
        if (available < quantity) {
            throw OrderException.insufficientStock(product.getName(), available);
        }

        CartItemDTO item = CartItemDTO.builder()
                .productId(product.getId())
                .productName(product.getName())
                .quantity(quantity)
                .unitPrice(product.getPrice())
                .primaryImage(product.getPrimaryImage())
                .build();

        SessionCart cart = cartFor(sessionId);
        synchronized (cart) {
            if (cart.items.containsKey(productId)) {
                throw OrderException.itemAlreadyInCart(product.getName());
            }
            cart.items.put(productId, item);
            log.info("Added item to cart: sessionId={}, productId={}, quantity={}", sessionId, productId, quantity);
            return cart.snapshot(sessionId);
        }
    }

    public CartDTO updateQuantity(String sessionId, Long productId, int quantity) {
        if (quantity <= 0) {
            throw OrderException.invalidQuantity();
        }

        SessionCart cart = cartFor(sessionId);
        synchronized (cart) {
            CartItemDTO existing = cart.items.get(productId);
            if (existing == null) {
                throw OrderException.productNotInCart(productId);
            }
            cart.items.put(productId, existing.toBuilder().quantity(quantity).build());
            log.info("Updated cart item: sessionId={}, productId={}, quantity={}", sessionId, productId, quantity);
            return cart.snapshot(sessionId);
        }
    }

    public CartItemDTO removeFromCart(String sessionId, Long productId) {
        SessionCart cart = cartFor(sessionId);
        synchronized (cart) {
            CartItemDTO removed = cart.items.remove(productId);
            if (removed == null) {
                throw OrderException.productNotInCart(productId);
            }
            log.info("Removed item from cart: sessionId={}, productId={}", sessionId, productId);
            return removed;
        }
    }

    public void clearCart(String sessionId) {
        SessionCart cart = carts.get(sessionId);
        if (cart == null) {
            return;
        }
        synchronized (cart) {
            cart.items.clear();
        }
        log.info("Cart cleared: sessionId={}", sessionId);
    }

    private SessionCart cartFor(String sessionId) {
        return carts.computeIfAbsent(sessionId, id -> new SessionCart());
    }

    private static final class SessionCart {

        private final Map<Long, CartItemDTO> items = new LinkedHashMap<>();

        synchronized CartDTO snapshot(String sessionId) {
            return CartDTO.of(sessionId, new ArrayList<>(items.values()));
        }
    }
}
