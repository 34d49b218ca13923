package com.shoplytic.order.dto;

import com.shoplytic.order.entity.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDTO {

    private Long id;
    private String sessionId;
    private String voucherCode;
    private List<OrderItemDTO> items;
    private String status;
    private BigDecimal totalAmount;
    private Integer totalQuantity;
    private LocalDateTime createdAt;

    public static OrderDTO fromEntity(Order order) {
        return OrderDTO.builder()
                .id(order.getId())
                .sessionId(order.getSessionId())
                .voucherCode(order.getVoucherCode())
                .items(order.getItems().stream()
                        .map(OrderItemDTO::fromEntity)
                        .toList())
                .status(order.getStatus().toJson())
                .totalAmount(order.getTotalAmount())
                .totalQuantity(order.getTotalQuantity())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
