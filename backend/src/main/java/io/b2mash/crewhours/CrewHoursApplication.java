package io.b2mash.crewhours;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrewHoursApplication {

  public static void main(String[] args) {
    SpringApplication.run(CrewHoursApplication.class, args);
  }
}
