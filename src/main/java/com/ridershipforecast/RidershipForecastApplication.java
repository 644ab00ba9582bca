package com.ridershipforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RidershipForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(RidershipForecastApplication.class, args);
    }
}
