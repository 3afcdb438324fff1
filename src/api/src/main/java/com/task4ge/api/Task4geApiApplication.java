package com.task4ge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Task4geApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(Task4geApiApplication.class, args);
  }
}
