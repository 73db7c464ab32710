package com.servealert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ServeAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServeAlertApplication.class, args);
    }
}
