package com.ai.hospital;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.ai.hospital.repository")
@EntityScan(basePackages = "com.ai.hospital.entity")
public class HospitalSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HospitalSchedulerApplication.class, args);
    }
}
