package com.edge.astrometry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeAstrometryApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeAstrometryApplication.class, args);
    }
}
