package com.oracle.optmcts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class OptMctsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptMctsApplication.class, args);
    }
}
