package com.shoplytic.order.service;

import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.dto.PurchaseResult;
import com.shoplytic.order.entity.Order;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.order.repository.OrderRepository;
import com.shoplytic.order.repository.ShippingInfoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final OrderRepository orderRepository;
    private final ShippingInfoRepository shippingInfoRepository;
    private final CartService cartService;
    private final PurchaseTransaction purchaseTransaction;

    /**
     * Places an order for the session's cart, paid with the given voucher.
     * <p>
     * Calling this again with a voucher that already paid for an order
     * returns that order instead of charging twice, whichever session placed it. The cart
     * is cleared only once the order has been committed.
     */
    public PurchaseResult purchase(String sessionId, String voucherCode) {
        String code = voucherCode == null ? "" : voucherCode.trim();

        Optional<PurchaseResult> replay = findReplay(code);
        if (replay.isPresent()) {
            return replay.get();
        }

        CartDTO cart = cartService.getCart(sessionId);
        if (cart.isEmpty()) {
            // A concurrent call may have committed and cleared the cart in between.
            return findReplay(code).orElseThrow(OrderException::emptyCart);
        }
        if (shippingInfoRepository.findBySessionId(sessionId).isEmpty()) {
            throw OrderException.shippingInfoRequired();
        }
        if (code.isEmpty()) {
            throw OrderException.voucherRequired();
        }

        PurchaseResult result;
        try {
            result = purchaseTransaction.commit(sessionId, code, cart.getItems());
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // Lost a race with a concurrent purchase using the same voucher.
            Order winner = orderRepository.findByVoucherCodeWithItems(code).orElseThrow(() -> e);
            log.info("Concurrent purchase converged: voucherCode={}, orderId={}", code, winner.getId());
            return PurchaseResult.replay(OrderDTO.fromEntity(winner));
        }

        if (!result.alreadyPlaced()) {
            cartService.clearCart(sessionId);
        }
        return result;
    }

    /**
     * The purchase already completed with the given voucher, if any.
     */
    @Transactional(readOnly = true)
    public Optional<PurchaseResult> findPlacedPurchase(String voucherCode) {
        return findReplay(voucherCode == null ? "" : voucherCode.trim());
    }

    private Optional<PurchaseResult> findReplay(String code) {
        if (code.isEmpty()) {
            return Optional.empty();
        }
        return orderRepository.findByVoucherCodeWithItems(code)
                .map(order -> {
                    log.info("Purchase already placed: voucherCode={}, orderId={}", code, order.getId());
                    return PurchaseResult.replay(OrderDTO.fromEntity(order));
                });
    }

    @Transactional(readOnly = true)
    public OrderDTO getOrder(String sessionId, Long orderId) {
        return orderRepository.findByIdAndSessionIdWithItems(orderId, sessionId)
                .map(OrderDTO::fromEntity)
                .orElseThrow(() -> OrderException.orderNotFound(orderId));
    }

    @Transactional(readOnly = true)
    public List<OrderDTO> getRecentOrders(String sessionId, int limit) {
        return findOrders(sessionId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<OrderDTO> getAllOrders(String sessionId) {
        return findOrders(sessionId, Pageable.unpaged());
    }

    private List<OrderDTO> findOrders(String sessionId, Pageable pageable) {
        List<Long> ids = orderRepository.findRecentIdsBySessionId(sessionId, pageable);
        if (ids.isEmpty()) {
            return List.of();
        }
        return orderRepository.findByIdInWithItems(ids).stream()
                .map(OrderDTO::fromEntity)
                .toList();
    }
}
