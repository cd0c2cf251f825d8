package com.flamingo.ai.regdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegDocsApplication {

  public static void main(String[] args) {
    SpringApplication.run(RegDocsApplication.class, args);
  }
}
