package com.paperharvest.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class PaperHarvestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperHarvestApplication.class, args);
    }
}
