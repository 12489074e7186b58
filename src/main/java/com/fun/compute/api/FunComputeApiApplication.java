package com.fun.compute.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FunComputeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunComputeApiApplication.class, args);
    }
}
