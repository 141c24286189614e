package com.scholary.podsummary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PodSummaryApplication {

  public static void main(String[] args) {
    SpringApplication.run(PodSummaryApplication.class, args);
  }
}
