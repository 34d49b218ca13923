package com.shoplytic.order.service;

import com.shoplytic.common.enums.OrderStatus;
import com.shoplytic.order.dto.CartItemDTO;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.dto.PurchaseResult;
import com.shoplytic.order.dto.ShippingInfoDTO;
import com.shoplytic.order.entity.Order;
import com.shoplytic.order.entity.OrderItem;
import com.shoplytic.order.entity.ShippingInfo;
import com.shoplytic.order.entity.Voucher;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.order.repository.OrderRepository;
import com.shoplytic.order.repository.ShippingInfoRepository;
import com.shoplytic.order.repository.VoucherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * The atomic part of a purchase: order, line snapshots and voucher
 * consumption commit together or not at all. Kept in its own bean so the
 * caller observes the commit before it touches the cart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class PurchaseTransaction {

    private final OrderRepository orderRepository;
    private final VoucherRepository voucherRepository;
    private final ShippingInfoRepository shippingInfoRepository;

    @Transactional
    public PurchaseResult commit(String sessionId, String voucherCode, List<CartItemDTO> cartItems) {
        if (cartItems.isEmpty()) {
            throw OrderException.emptyCart();
        }

        ShippingInfo shipping = shippingInfoRepository.findBySessionId(sessionId)
                .orElseThrow(OrderException::shippingInfoRequired);

        Voucher voucher = voucherRepository.findByCodeForUpdate(voucherCode)
                .orElseThrow(() -> OrderException.voucherNotFound(voucherCode));

        Optional<Order> existing = orderRepository.findByVoucherCodeWithItems(voucherCode);
        if (existing.isPresent()) {
            log.info("Purchase replay: voucherCode={}, orderId={}", voucherCode, existing.get().getId());
            return PurchaseResult.replay(OrderDTO.fromEntity(existing.get()));
        }

        if (Boolean.TRUE.equals(voucher.getUsed())) {
            log.error("Voucher marked used without an order: voucherCode={}, usedBy={}",
                    voucherCode, voucher.getUsedBySession());
            throw OrderException.voucherStateInconsistent(voucherCode);
        }

        LocalDateTime now = LocalDateTime.now();
        if (voucher.isExpired(now)) {
            throw OrderException.voucherExpired(voucherCode);
        }

        BigDecimal total = cartItems.stream()
                .map(CartItemDTO::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        if (voucher.getAmount().compareTo(total) < 0) {
            throw OrderException.insufficientVoucherBalance(total, voucher.getAmount());
        }

        Order order = Order.builder()
                .sessionId(sessionId)
                .voucherCode(voucherCode)
                .totalAmount(total)
                .status(OrderStatus.COMPLETED)
                .build();

        for (CartItemDTO cartItem : cartItems) {
            order.addItem(OrderItem.builder()
                    .productId(cartItem.getProductId())
                    .productName(cartItem.getProductName())
                    .quantity(cartItem.getQuantity())
                    .unitPrice(cartItem.getUnitPrice())
                    .subtotal(cartItem.getSubtotal())
                    .build());
        }

        voucher.markUsed(sessionId, now);

        // Flush here so a unique voucher_code violation surfaces inside this call.
        order = orderRepository.saveAndFlush(order);
        voucherRepository.save(voucher);

        log.info("Order created: orderId={}, sessionId={}, total={}, voucherCode={}",
                order.getId(), sessionId, total, voucherCode);

        return PurchaseResult.placed(
                OrderDTO.fromEntity(order),
                voucher.getAmount().subtract(total),
                ShippingInfoDTO.fromEntity(shipping));
    }
}
