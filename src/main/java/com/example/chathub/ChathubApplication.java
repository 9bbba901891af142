package com.example.chathub;

import com.example.chathub.config.ChathubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ChathubProperties.class)
public class ChathubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChathubApplication.class, args);
    }
}
