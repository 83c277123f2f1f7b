package com.example.vparam;

import com.example.vparam.config.VparamProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VparamProperties.class)
public class VparamApplication {

    public static void main(String[] args) {
        SpringApplication.run(VparamApplication.class, args);
    }

}
