package me.internalizable.socialflood;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SocialFloodApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialFloodApplication.class, args);
    }
}
