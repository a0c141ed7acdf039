package com.scholary.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScribePipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScribePipelineApplication.class, args);
  }
}
