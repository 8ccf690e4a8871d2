package com.jreinhal.zerag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ZeragApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZeragApplication.class, args);
    }
}
