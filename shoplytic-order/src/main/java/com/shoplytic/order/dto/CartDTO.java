package com.shoplytic.order.dto;

import com.shoplytic.common.util.Money;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartDTO {

    private String sessionId;
    private List<CartItemDTO> items;
    private Integer totalItems;
    private BigDecimal totalAmount;
    private String formattedTotal;

    public static CartDTO of(String sessionId, List<CartItemDTO> items) {
        BigDecimal total = items.stream()
                .map(CartItemDTO::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return CartDTO.builder()
                .sessionId(sessionId)
                .items(List.copyOf(items))
                .totalItems(items.size())
                .totalAmount(Money.scale(total))
                .formattedTotal(Money.format(total))
                .build();
    }

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
