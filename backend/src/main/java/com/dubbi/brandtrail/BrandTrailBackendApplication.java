package com.dubbi.brandtrail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class BrandTrailBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BrandTrailBackendApplication.class, args);
    }
}
