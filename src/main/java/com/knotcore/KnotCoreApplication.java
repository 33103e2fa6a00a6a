package com.knotcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Knot Core Application
 *
 * Personalization and delivery core built with Spring Boot WebFlux:
 * milestone notifications, learned preference weights, recommendation scoring
 * and semantic hint retrieval.
 */
@SpringBootApplication
@EnableScheduling
public class KnotCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnotCoreApplication.class, args);
    }

}
