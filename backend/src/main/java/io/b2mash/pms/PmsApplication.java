package io.b2mash.pms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PmsApplication {

  public static void main(String[] args) {
    SpringApplication.run(PmsApplication.class, args);
  }
}
