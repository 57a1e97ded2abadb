package com.dbtide.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DbtIdeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbtIdeApplication.class, args);
    }
}
