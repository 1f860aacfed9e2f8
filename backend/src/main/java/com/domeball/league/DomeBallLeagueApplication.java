package com.domeball.league;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DomeBallLeagueApplication {
    public static void main(String[] args) {
        SpringApplication.run(DomeBallLeagueApplication.class, args);
    }
}
