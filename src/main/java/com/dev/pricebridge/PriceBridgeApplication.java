package com.dev.pricebridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * This class contains the startup of the application.
 */
@SpringBootApplication
public class PriceBridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(PriceBridgeApplication.class, args);
  }

}
