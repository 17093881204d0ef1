package com.adlab.backend.global.common.random;

import java.util.concurrent.ThreadLocalRandom;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RandomConfig {

    @Bean
    public ProbabilitySource probabilitySource() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }
}
