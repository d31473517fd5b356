package com.mk.fx.qa.device.load;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeviceLoadApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeviceLoadApplication.class, args);
  }
}
