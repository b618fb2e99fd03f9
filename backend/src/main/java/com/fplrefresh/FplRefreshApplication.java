package com.fplrefresh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FplRefreshApplication {

    public static void main(String[] args) {
        SpringApplication.run(FplRefreshApplication.class, args);
    }
}
