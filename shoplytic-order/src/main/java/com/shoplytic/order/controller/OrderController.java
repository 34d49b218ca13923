package com.shoplytic.order.controller;

import com.shoplytic.common.web.SessionIdResolver;
import com.shoplytic.order.dto.OrderDTO;
import com.shoplytic.order.service.OrderService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/user/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    /**
     * All orders of the calling session, newest first.
     */
    @GetMapping
    public ResponseEntity<List<OrderDTO>> getOrders(HttpServletRequest request) {
        return ResponseEntity.ok(orderService.getAllOrders(SessionIdResolver.resolve(request)));
    }
}
