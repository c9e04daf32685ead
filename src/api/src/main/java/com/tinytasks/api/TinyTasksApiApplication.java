package com.tinytasks.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TinyTasksApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(TinyTasksApiApplication.class, args);
  }
}
