package com.scholary.dubbing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DubbingApplication {

  public static void main(String[] args) {
    SpringApplication.run(DubbingApplication.class, args);
  }
}
