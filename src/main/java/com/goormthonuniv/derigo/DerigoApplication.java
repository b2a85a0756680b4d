package com.goormthonuniv.derigo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DerigoApplication {

    public static void main(String[] args) {
        SpringApplication.run(DerigoApplication.class, args);
    }
}
