package com.streamfirst.interchain.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InterchainBufferApplication {

  public static void main(String[] args) {
    SpringApplication.run(InterchainBufferApplication.class, args);
  }
}
