package com.jumbo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// The projection database is opened by LocalInfrastructureModule, not by Boot.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class JumboApplication {

    public static void main(String[] args) {
        SpringApplication.run(JumboApplication.class, args);
    }
}
