package com.williamcallahan.actdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ActDbApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ActDbApplication.class, args)));
    }

}
