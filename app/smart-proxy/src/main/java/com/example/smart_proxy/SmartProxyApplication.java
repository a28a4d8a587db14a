package com.example.smart_proxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@RestController
public class SmartProxyApplication {

  public static void main(String[] args) {
    SpringApplication.run(SmartProxyApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "smart-proxy: ok";
  }
}
