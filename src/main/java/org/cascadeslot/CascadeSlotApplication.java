package org.cascadeslot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CascadeSlotApplication {
    public static void main(String[] args) {
        SpringApplication.run(CascadeSlotApplication.class, args);
    }
}
