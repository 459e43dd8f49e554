package com.tubedigest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TubeDigestApplication {

  public static void main(String[] args) {
    SpringApplication.run(TubeDigestApplication.class, args);
  }
}
