package com.leadharvest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadHarvestApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadHarvestApplication.class, args);
  }
}
