package com.devevent.registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DevEventRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevEventRegistryApplication.class, args);
    }
}
