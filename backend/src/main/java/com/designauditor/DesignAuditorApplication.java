package com.designauditor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DesignAuditorApplication {

  public static void main(String[] args) {
    SpringApplication.run(DesignAuditorApplication.class, args);
  }
}
