package com.hookshape;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HookshapeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookshapeApplication.class, args);
    }
}
