package com.skillmap.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Topic & Skill catalog service.
 *
 * To run against PostgreSQL (schema is created by Flyway on startup):
 *   DATABASE_URL=jdbc:postgresql://localhost:5432/topics_db mvn -pl catalog spring-boot:run
 *
 * To run without a database:
 *   mvn -pl catalog spring-boot:run -Dspring-boot.run.profiles=memory
 */
@SpringBootApplication
public class CatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogApplication.class, args);
    }
}
