package com.retailops;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@Slf4j
public class RetailOpsGatewayApplication {

    public static void main(String[] args) {
        log.info("Starting RetailOps tool gateway");
        SpringApplication.run(RetailOpsGatewayApplication.class, args);
        log.info("RetailOps tool gateway started");
    }

}
