package com.shoplytic.order.service;

import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.product.dto.ProductDTO;
import com.shoplytic.product.service.ProductService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CartServiceTest {

    private static final String SESSION = "session_0123456789abcdef";

    @Mock
    private ProductService productService;

    private CartService cartService;

    @BeforeEach
    void setUp() {
        cartService = new CartService(productService);
    }

    private static ProductDTO product(long id, String name, String price, int stock, boolean active) {
        return ProductDTO.builder()
                .id(id)
                .name(name)
                .price(new BigDecimal(price))
                .stockQuantity(stock)
                .active(active)
                .featured(false)
                .build();
    }

    @Test
    @DisplayName("Adding a product twice is rejected and the cart keeps one line")
    void addDuplicateIsRejected() {
        when(productService.findProduct(12L)).thenReturn(Optional.of(product(12L, "Trail Cap", "22.99", 10, true)));

        CartDTO cart = cartService.addToCart(SESSION, 12L, 1);
        assertThat(cart.getItems()).hasSize(1);

        assertThatThrownBy(() -> cartService.addToCart(SESSION, 12L, 2))
                .isInstanceOf(OrderException.class)
                .hasMessageContaining("already in your cart")
                .hasMessageContaining("edit_item_in_cart");

        assertThat(cartService.getCart(SESSION).getItems())
                .singleElement()
                .satisfies(item -> assertThat(item.getQuantity()).isEqualTo(1));
    }

    @Test
    void addRejectsUnknownInactiveAndShortStock() {
        when(productService.findProduct(1L)).thenReturn(Optional.empty());
        when(productService.findProduct(2L)).thenReturn(Optional.of(product(2L, "Old Lens", "99.00", 5, false)));
        when(productService.findProduct(3L)).thenReturn(Optional.of(product(3L, "Headphones", "149.00", 2, true)));

        assertThatThrownBy(() -> cartService.addToCart(SESSION, 1L, 1))
                .hasMessage("Product with ID 1 not found.");
        assertThatThrownBy(() -> cartService.addToCart(SESSION, 2L, 1))
                .hasMessage("Product 'Old Lens' is not available for purchase.");
        assertThatThrownBy(() -> cartService.addToCart(SESSION, 3L, 5))
                .hasMessage("Insufficient stock. Only 2 available for 'Headphones'.");

        assertThat(cartService.getCart(SESSION).isEmpty()).isTrue();
    }

    @Test
    void updateAndRemove() {
        when(productService.findProduct(7L)).thenReturn(Optional.of(product(7L, "Socks", "22.99", 10, true)));
        cartService.addToCart(SESSION, 7L, 1);

        CartDTO updated = cartService.updateQuantity(SESSION, 7L, 2);
        assertThat(updated.getTotalAmount()).isEqualByComparingTo("45.98");
        assertThat(updated.getFormattedTotal()).isEqualTo("$45.98");

        assertThatThrownBy(() -> cartService.updateQuantity(SESSION, 7L, 0))
                .hasMessageContaining("Quantity must be greater than 0");
        assertThatThrownBy(() -> cartService.updateQuantity(SESSION, 99L, 1))
                .hasMessage("Product with ID 99 not found in cart.");

        assertThat(cartService.removeFromCart(SESSION, 7L).getProductName()).isEqualTo("Socks");
        assertThat(cartService.getCart(SESSION).isEmpty()).isTrue();
    }

    @Test
    void sessionsAreIsolated() {
        when(productService.findProduct(7L)).thenReturn(Optional.of(product(7L, "Socks", "22.99", 10, true)));
        cartService.addToCart(SESSION, 7L, 1);

        assertThat(cartService.getCart("session_other").isEmpty()).isTrue();
        cartService.clearCart("session_other");
        assertThat(cartService.getCart(SESSION).getItems()).hasSize(1);
    }

    @Test
    @DisplayName("Concurrent adds of the same product leave exactly one line")
    void concurrentAddsKeepProductUnique() throws Exception {
        lenient().when(productService.findProduct(anyLong()))
                .thenReturn(Optional.of(product(5L, "Sneaker", "80.00", 100, true)));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> {
                    try {
                        cartService.addToCart(SESSION, 5L, 1);
                        return true;
                    } catch (OrderException e) {
                        return false;
                    }
                });
            }
            int succeeded = 0;
            for (Future<Boolean> result : pool.invokeAll(tasks)) {
                if (result.get()) {
                    succeeded++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(cartService.getCart(SESSION).getItems()).hasSize(1);
    }
}
