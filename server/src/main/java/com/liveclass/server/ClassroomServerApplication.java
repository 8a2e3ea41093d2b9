package com.liveclass.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Pool and schema are set up by {@link com.liveclass.server.config.DatabaseConfig}, or skipped
 * entirely with the in-memory stores.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ClassroomServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassroomServerApplication.class, args);
    }
}
