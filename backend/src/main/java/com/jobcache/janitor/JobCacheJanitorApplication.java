package com.jobcache.janitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobCacheJanitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobCacheJanitorApplication.class, args);
  }
}
