package com.openforge.sidekick;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SidekickApplication {

    public static void main(String[] args) {
        SpringApplication.run(SidekickApplication.class, args);
    }
}
