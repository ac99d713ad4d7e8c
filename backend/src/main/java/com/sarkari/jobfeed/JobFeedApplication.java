package com.sarkari.jobfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobFeedApplication.class, args);
  }
}
