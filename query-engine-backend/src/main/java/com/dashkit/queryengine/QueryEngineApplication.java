package com.dashkit.queryengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(QueryEngineApplication.class, args);
    }
}
