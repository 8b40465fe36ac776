package com.teambind.lottery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LotteryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LotteryEngineApplication.class, args);
    }
}
