package com.roomsignal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RoomSignalingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomSignalingApplication.class, args);
    }

}
