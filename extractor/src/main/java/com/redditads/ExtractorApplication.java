package com.redditads;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExtractorApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ExtractorApplication.class);
        application.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
