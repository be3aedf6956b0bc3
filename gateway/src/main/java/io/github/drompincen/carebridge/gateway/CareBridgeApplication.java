package io.github.drompincen.carebridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.carebridge")
@EntityScan(basePackages = "io.github.drompincen.carebridge.persistence.entity")
@EnableJpaRepositories(basePackages = "io.github.drompincen.carebridge.persistence.repository")
@EnableScheduling
public class CareBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareBridgeApplication.class, args);
    }
}
