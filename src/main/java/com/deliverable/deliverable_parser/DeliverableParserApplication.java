package com.deliverable.deliverable_parser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeliverableParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeliverableParserApplication.class, args);
    }
}
