package dev.devanks.energy.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnergyPipelineApplication {
    public static void main(String[] args) {
        SpringApplication.run(EnergyPipelineApplication.class, args);
    }
}
