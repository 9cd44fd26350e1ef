package com.shlawgathon.leafscan.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeafScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeafScanApplication.class, args);
    }
}
