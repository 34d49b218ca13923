package com.shoplytic.order.service;

import com.shoplytic.order.dto.ShippingInfoDTO;
import com.shoplytic.order.dto.ShippingInfoRequest;
import com.shoplytic.order.entity.ShippingInfo;
import com.shoplytic.order.exception.OrderException;
import com.shoplytic.order.repository.ShippingInfoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Per-session shipping details. A session has at most one record; creating
 * again overwrites it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShippingInfoService {

    private final ShippingInfoRepository shippingInfoRepository;

    public record SaveResult(ShippingInfoDTO shipping, boolean created) {
    }

    @Transactional(readOnly = true)
    public Optional<ShippingInfoDTO> getShippingInfo(String sessionId) {
        return shippingInfoRepository.findBySessionId(sessionId).map(ShippingInfoDTO::fromEntity);
    }

    @Transactional
    public SaveResult saveShippingInfo(String sessionId, ShippingInfoRequest request) {
        String fullName = required(request.getFullName(), "Full name", ShippingInfo.MAX_FULL_NAME);
        String address = required(request.getAddress(), "Address", ShippingInfo.MAX_ADDRESS);
        String city = required(request.getCity(), "City", ShippingInfo.MAX_CITY);
        String zipCode = required(request.getZipCode(), "Zip code", ShippingInfo.MAX_ZIP_CODE);

        Optional<ShippingInfo> existing = shippingInfoRepository.findBySessionId(sessionId);
        ShippingInfo info = existing.orElseGet(() -> ShippingInfo.builder().sessionId(sessionId).build());
        info.setFullName(fullName);
        info.setAddress(address);
        info.setCity(city);
        info.setZipCode(zipCode);

        info = shippingInfoRepository.save(info);
        log.info("Shipping info {}: sessionId={}", existing.isPresent() ? "updated" : "created", sessionId);
        return new SaveResult(ShippingInfoDTO.fromEntity(info), existing.isEmpty());
    }

    /**
     * Applies the non-null fields of the request to the existing record.
     */
    @Transactional
    public ShippingInfoDTO updateShippingInfo(String sessionId, ShippingInfoRequest request) {
        ShippingInfo info = shippingInfoRepository.findBySessionId(sessionId)
                .orElseThrow(OrderException::shippingInfoNotFound);

        boolean changed = false;
        if (request.getFullName() != null) {
            info.setFullName(required(request.getFullName(), "Full name", ShippingInfo.MAX_FULL_NAME));
            changed = true;
        }
        if (request.getAddress() != null) {
            info.setAddress(required(request.getAddress(), "Address", ShippingInfo.MAX_ADDRESS));
            changed = true;
        }
        if (request.getCity() != null) {
            info.setCity(required(request.getCity(), "City", ShippingInfo.MAX_CITY));
            changed = true;
        }
        if (request.getZipCode() != null) {
            info.setZipCode(required(request.getZipCode(), "Zip code", ShippingInfo.MAX_ZIP_CODE));
            changed = true;
        }

        if (!changed) {
            throw OrderException.invalidShippingInfo("No valid fields provided to update. "
                    + "Please specify at least one field: fullName, address, city, or zipCode.");
        }

        info = shippingInfoRepository.save(info);
        log.info("Shipping info edited: sessionId={}", sessionId);
        return ShippingInfoDTO.fromEntity(info);
    }

    private static String required(String value, String field, int maxLength) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw OrderException.invalidShippingInfo(field + " cannot be empty.");
        }
        if (trimmed.length() > maxLength) {
            throw OrderException.invalidShippingInfo(
                    String.format("%s must be %d characters or less.", field, maxLength));
        }
        return trimmed;
    }
}
