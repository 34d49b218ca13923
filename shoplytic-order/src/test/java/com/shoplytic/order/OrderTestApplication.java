package com.shoplytic.order;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderTestApplication {
}
