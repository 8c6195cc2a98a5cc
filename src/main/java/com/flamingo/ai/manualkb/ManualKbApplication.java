package com.flamingo.ai.manualkb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ManualKbApplication {

  public static void main(String[] args) {
    SpringApplication.run(ManualKbApplication.class, args);
  }
}
