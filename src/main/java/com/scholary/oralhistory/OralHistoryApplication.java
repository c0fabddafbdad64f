package com.scholary.oralhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class OralHistoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(OralHistoryApplication.class, args);
  }
}
