package com.github.dimitryivaniuta.edgeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EdgeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeGuardApplication.class, args);
    }
}
