package com.ekslens.leadmaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadMasterApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeadMasterApplication.class, args);
  }
}
