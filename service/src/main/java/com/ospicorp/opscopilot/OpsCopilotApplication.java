package com.ospicorp.opscopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OpsCopilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpsCopilotApplication.class, args);
  }
}
