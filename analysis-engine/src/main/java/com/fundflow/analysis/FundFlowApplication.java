package com.fundflow.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundFlowApplication.class, args);
    }
}
