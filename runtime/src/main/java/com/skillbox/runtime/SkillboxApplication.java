package com.skillbox.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillboxApplication.class, args);
    }
}
