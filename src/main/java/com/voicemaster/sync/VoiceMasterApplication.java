package com.voicemaster.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.voicemaster.sync")
public class VoiceMasterApplication {
    public static void main(String[] args) {
        SpringApplication.run(VoiceMasterApplication.class, args);
    }
}
