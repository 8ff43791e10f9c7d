package org.lite.registry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PromptRegistryApplication {
    public static void main(String[] args) {
        SpringApplication.run(PromptRegistryApplication.class, args);
    }
}
