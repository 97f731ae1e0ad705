package com.example.apistress;

import com.example.apistress.config.StressTestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StressTestProperties.class)
public class ApiStressTesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiStressTesterApplication.class, args);
    }
}
