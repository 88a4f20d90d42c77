package io.b2mash.crewhours.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TimeTrackingProperties.class)
public class TimeTrackingConfig {

  @Bean
  Clock clock(TimeTrackingProperties properties) {
    return Clock.system(properties.zone());
  }
}
