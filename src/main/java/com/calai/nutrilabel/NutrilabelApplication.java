package com.calai.nutrilabel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NutrilabelApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutrilabelApplication.class, args);
    }
}
