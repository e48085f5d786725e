package com.cario.scholar.app;

import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Scholar Enrichment Service.
 *
 * <p>The service ingests bibliographic records, enriches their authors with affiliations, registry
 * identities, roles and citation metrics, and writes the result to the relational store. Batches
 * run as resumable sessions. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
public class ScholarEnrichmentServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Scholar Enrichment Service application...");
    SpringApplication.run(ScholarEnrichmentServiceApplication.class, args);
    log.info("Scholar Enrichment Service application started successfully.");
  }
}
