package com.delta.leadgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadGeneratorApplication.class, args);
  }
}
