package com.genex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GenexApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenexApplication.class, args);
    }
}
