package com.spiderjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpiderJobsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpiderJobsApplication.class, args);
  }
}
