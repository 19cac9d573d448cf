package com.pulse.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PulseForecastApplication {
    public static void main(String[] args) {
        SpringApplication.run(PulseForecastApplication.class, args);
    }
}
