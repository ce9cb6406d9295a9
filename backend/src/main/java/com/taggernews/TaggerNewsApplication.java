package com.taggernews;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaggerNewsApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaggerNewsApplication.class, args);
  }
}
