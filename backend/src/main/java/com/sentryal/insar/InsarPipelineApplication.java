package com.sentryal.insar;

import com.sentryal.insar.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
public class InsarPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsarPipelineApplication.class, args);
    }
}
