package com.example.helpdesk.qabot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QaBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(QaBotApplication.class, args);
    }

}
