package com.example.datalake.mnemo;

import com.example.datalake.mnemo.config.MnemoProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MnemoProperties.class)
public class MnemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(MnemoApplication.class, args);
    }

}
