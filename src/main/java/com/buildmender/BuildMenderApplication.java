package com.buildmender;

import com.buildmender.config.BuildMenderProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BuildMenderProperties.class)
public class BuildMenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BuildMenderApplication.class, args);
    }
}
