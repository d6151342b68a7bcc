package com.xyznexus.agent;

import com.xyznexus.agent.config.NexusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(NexusProperties.class)
public class XyzNexusApplication {
    public static void main(String[] args) {
        SpringApplication.run(XyzNexusApplication.class, args);
    }
}
