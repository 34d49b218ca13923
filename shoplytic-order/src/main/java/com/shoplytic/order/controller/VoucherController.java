package com.shoplytic.order.controller;

import com.shoplytic.common.web.SessionIdResolver;
import com.shoplytic.order.dto.VoucherDTO;
import com.shoplytic.order.service.VoucherService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user/vouchers")
@RequiredArgsConstructor
public class VoucherController {

    private final VoucherService voucherService;

    @PostMapping("/generate")
    public ResponseEntity<VoucherDTO> generateVoucher(HttpServletRequest request) {
        VoucherDTO voucher = voucherService.generateVoucher(SessionIdResolver.resolve(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(voucher);
    }
}
