package com.asvarishch.wheel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WheelApplication {

    public static void main(String[] args) {
        SpringApplication.run(WheelApplication.class, args);
    }
}
