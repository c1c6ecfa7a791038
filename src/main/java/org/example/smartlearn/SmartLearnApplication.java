package org.example.smartlearn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartLearnApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartLearnApplication.class, args);
    }
}
