package com.artifactduo.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ArtifactDuoServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtifactDuoServerApplication.class, args);
    }

}
