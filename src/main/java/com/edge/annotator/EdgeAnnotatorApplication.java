package com.edge.annotator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeAnnotatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeAnnotatorApplication.class, args);
    }
}
