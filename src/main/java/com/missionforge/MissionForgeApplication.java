package com.missionforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MissionForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MissionForgeApplication.class, args);
    }
}
