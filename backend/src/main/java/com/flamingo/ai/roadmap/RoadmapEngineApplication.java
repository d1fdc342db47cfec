package com.flamingo.ai.roadmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoadmapEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RoadmapEngineApplication.class, args);
  }
}
