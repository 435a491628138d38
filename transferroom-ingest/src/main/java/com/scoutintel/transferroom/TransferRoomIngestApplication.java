package com.scoutintel.transferroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class TransferRoomIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferRoomIngestApplication.class, args);
    }
}
