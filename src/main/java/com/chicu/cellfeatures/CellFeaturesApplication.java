package com.chicu.cellfeatures;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.cellfeatures")
public class CellFeaturesApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellFeaturesApplication.class, args);
    }
}
