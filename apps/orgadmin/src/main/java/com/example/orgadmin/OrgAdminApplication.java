package com.example.orgadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrgAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrgAdminApplication.class, args);
    }
}
