package com.delta.prospector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProspectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProspectorApplication.class, args);
  }
}
