package com.github.adamzv.brokerdispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BrokerDispatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(BrokerDispatchApplication.class, args);
  }
}
