package com.wagesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WageSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(WageSearchApplication.class, args);
  }
}
