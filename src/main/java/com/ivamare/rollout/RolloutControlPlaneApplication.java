package com.ivamare.rollout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;

/**
 * Standalone control plane. Every bean comes from {@link RolloutAutoConfiguration}.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class RolloutControlPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(RolloutControlPlaneApplication.class, args);
    }
}
