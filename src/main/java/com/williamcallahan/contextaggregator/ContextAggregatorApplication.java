package com.williamcallahan.contextaggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextAggregatorApplication.class, args);
    }
}
