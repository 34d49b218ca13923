package com.shoplytic.order.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shipping details supplied by the caller. Every field is optional here;
 * creation requires all of them, an edit only the ones being changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShippingInfoRequest {

    private String fullName;
    private String address;
    private String city;
    private String zipCode;
}
