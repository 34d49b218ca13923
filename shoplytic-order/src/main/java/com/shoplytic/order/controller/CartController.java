package com.shoplytic.order.controller;

import com.shoplytic.common.web.SessionIdResolver;
import com.shoplytic.order.dto.CartDTO;
import com.shoplytic.order.service.CartService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/user/cart")
@RequiredArgsConstructor
public class CartController {

    private final CartService cartService;

    @GetMapping
    public ResponseEntity<CartDTO> getCart(HttpServletRequest request) {
        return ResponseEntity.ok(cartService.getCart(SessionIdResolver.resolve(request)));
    }
}
