package com.mirrorup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MirrorUpApplication {

  public static void main(String[] args) {
    SpringApplication.run(MirrorUpApplication.class, args);
  }
}
