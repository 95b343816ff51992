package com.boardsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BoardSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(BoardSyncApplication.class, args);
  }
}
