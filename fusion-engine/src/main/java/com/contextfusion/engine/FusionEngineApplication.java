package com.contextfusion.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FusionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FusionEngineApplication.class, args);
    }
}
