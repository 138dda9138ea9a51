package com.tba3.mock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Tba3MockApplication {
    public static void main(String[] args) {
        SpringApplication.run(Tba3MockApplication.class, args);
    }
}
