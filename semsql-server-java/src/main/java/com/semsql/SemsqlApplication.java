package com.semsql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SemsqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemsqlApplication.class, args);
    }
}
