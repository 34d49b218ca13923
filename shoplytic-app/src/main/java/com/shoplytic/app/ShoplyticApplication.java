package com.shoplytic.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication(scanBasePackages = "com.shoplytic")
@EntityScan(basePackages = "com.shoplytic")
@EnableJpaRepositories(basePackages = "com.shoplytic")
@EnableAsync
public class ShoplyticApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShoplyticApplication.class, args);
    }
}
