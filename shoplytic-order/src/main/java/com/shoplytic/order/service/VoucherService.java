package com.shoplytic.order.service;

import com.shoplytic.order.dto.VoucherDTO;
import com.shoplytic.order.entity.Voucher;
import com.shoplytic.order.repository.VoucherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class VoucherService {

    private static final String CODE_PREFIX = "VOUCHER-";
    private static final int CODE_HEX_LENGTH = 16;

    private final VoucherRepository voucherRepository;

    @Value("${shoplytic.voucher.amount:2000.00}")
    private BigDecimal voucherAmount;

    /**
     * Returns the session's unused voucher, issuing a new one if it has none.
     */
    @Transactional
    public VoucherDTO generateVoucher(String sessionId) {
        return voucherRepository.findFirstByGeneratedBySessionAndUsedFalseOrderByCreatedAtDesc(sessionId)
                .map(existing -> {
                    log.debug("Returning existing voucher for sessionId={}", sessionId);
                    return VoucherDTO.fromEntity(existing);
                })
                .orElseGet(() -> issue(sessionId));
    }

    private VoucherDTO issue(String sessionId) {
        String code;
        do {
            code = CODE_PREFIX + UUID.randomUUID().toString().replace("-", "")
                    .substring(0, CODE_HEX_LENGTH)
                    .toUpperCase(Locale.ROOT);
        } while (voucherRepository.existsByCode(code));

        Voucher voucher = Voucher.builder()
                .code(code)
                .amount(voucherAmount)
                .generatedBySession(sessionId)
                .build();

        voucher = voucherRepository.save(voucher);
        log.info("Voucher issued: code={}, sessionId={}, amount={}", code, sessionId, voucherAmount);
        return VoucherDTO.fromEntity(voucher);
    }
}
