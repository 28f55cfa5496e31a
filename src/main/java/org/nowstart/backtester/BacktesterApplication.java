package org.nowstart.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(BacktesterApplication.class, args);
    }
}
