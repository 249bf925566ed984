package com.openforge.aacsecurity;

import com.openforge.aacsecurity.config.SecurityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SecurityProperties.class)
public class AacSecurityApplication {

    public static void main(String[] args) {
        SpringApplication.run(AacSecurityApplication.class, args);
    }
}
