package com.shoplytic.order.dto;

import com.shoplytic.order.entity.Voucher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoucherDTO {

    private String code;
    private BigDecimal amount;
    private Boolean used;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;

    public static VoucherDTO fromEntity(Voucher voucher) {
        return VoucherDTO.builder()
                .code(voucher.getCode())
                .amount(voucher.getAmount())
                .used(voucher.getUsed())
                .createdAt(voucher.getCreatedAt())
                .expiresAt(voucher.getExpiresAt())
                .build();
    }
}
