package com.geobuffer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Geo Buffer Server - linear buffer analysis over a circular-query spatial index
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GeoBufferApplication {
    public static void main(String[] args) {
        SpringApplication.run(GeoBufferApplication.class, args);
    }
}
