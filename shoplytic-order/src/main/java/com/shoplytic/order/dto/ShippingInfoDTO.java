package com.shoplytic.order.dto;

import com.shoplytic.order.entity.ShippingInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingInfoDTO {

    private String fullName;
    private String address;
    private String city;
    private String zipCode;
    private LocalDateTime updatedAt;

    public static ShippingInfoDTO fromEntity(ShippingInfo info) {
        return ShippingInfoDTO.builder()
                .fullName(info.getFullName())
                .address(info.getAddress())
                .city(info.getCity())
                .zipCode(info.getZipCode())
                .updatedAt(info.getUpdatedAt())
                .build();
    }
}
