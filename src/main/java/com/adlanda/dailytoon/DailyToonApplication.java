package com.adlanda.dailytoon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DailyToon - Main Application
 *
 * Turns a short daily story into an illustrated comic episode: a text model
 * breaks the story into panels, and an image service renders each panel on
 * demand. Generated images are stored with the episode and served from there
 * on later requests.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for the storyboard text model (OpenAI-compatible endpoint)
 * - Spring Data JPA over PostgreSQL for episodes and panel images
 * - Resilience4j for retrying the image service
 */
@SpringBootApplication
public class DailyToonApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyToonApplication.class, args);
    }
}
