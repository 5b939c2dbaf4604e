package com.flamingo.ai.studyplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/** Entry point of the study planner service. */
@SpringBootApplication
@ConfigurationPropertiesScan
public class StudyPlannerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudyPlannerApplication.class, args);
  }
}
