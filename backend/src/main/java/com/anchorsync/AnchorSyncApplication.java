package com.anchorsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnchorSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnchorSyncApplication.class, args);
    }
}
