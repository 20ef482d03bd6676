package com.synthetic.issuance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IssuanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssuanceEngineApplication.class, args);
    }
}
