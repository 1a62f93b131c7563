package com.ospicorp.sustainability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// No user store: the API is open and Spring Security only adds response headers.
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class SustainabilityActionsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SustainabilityActionsApplication.class, args);
  }
}
