package com.classsched.classsched_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClassschedApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassschedApiApplication.class, args);
    }
}
