package com.gdin.explorer.network;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetworkBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkBuilderApplication.class, args);
    }
}
