package com.flamingo.ai.md2db;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the Markdown question bank ingestion service. */
@SpringBootApplication
public class Md2dbApplication {

  public static void main(String[] args) {
    SpringApplication.run(Md2dbApplication.class, args);
  }
}
