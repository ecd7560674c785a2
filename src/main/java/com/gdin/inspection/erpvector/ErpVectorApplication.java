package com.gdin.inspection.erpvector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ErpVectorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ErpVectorApplication.class, args);
    }
}
