package com.delta.jobingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobIngestApplication.class, args);
  }
}
