package com.realestate.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RealEstateScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(RealEstateScraperApplication.class, args);
  }
}
