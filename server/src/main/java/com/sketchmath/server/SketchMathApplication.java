package com.sketchmath.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SketchMathApplication {

    public static void main(String[] args) {
        SpringApplication.run(SketchMathApplication.class, args);
    }
}
