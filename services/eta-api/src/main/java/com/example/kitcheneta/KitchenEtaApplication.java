package com.example.kitcheneta;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.example.kitcheneta.repository")
@EntityScan(basePackages = "com.example.kitcheneta.model")
@EnableCaching
public class KitchenEtaApplication {
    public static void main(String[] args) {
        SpringApplication.run(KitchenEtaApplication.class, args);
    }
}
