package com.deepansh.explorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExplorerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExplorerApplication.class, args);
    }
}
