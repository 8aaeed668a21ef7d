package com.tenderwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TenderMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenderMonitorApplication.class, args);
  }
}
