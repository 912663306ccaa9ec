package com.koni.tracking;

import com.koni.tracking.infrastructure.config.TrackingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tracking server: ingests gateway messages, summarizes tag locations and raises violations.
 * Connections come from the tracking connection pool, never from a Spring {@code DataSource}.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(TrackingProperties.class)
public class TrackingServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackingServerApplication.class, args);
    }
}
