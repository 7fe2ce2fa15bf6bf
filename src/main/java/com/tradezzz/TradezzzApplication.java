package com.tradezzz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradezzzApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradezzzApplication.class, args);
    }
}
