package io.github.drompincen.carebridge.persistence;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableAutoConfiguration
@EntityScan(basePackages = "io.github.drompincen.carebridge.persistence.entity")
@EnableJpaRepositories(basePackages = "io.github.drompincen.carebridge.persistence.repository")
public class TestJpaConfiguration {
}
