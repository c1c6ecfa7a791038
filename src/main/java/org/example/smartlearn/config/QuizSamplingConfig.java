package org.example.smartlearn.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class QuizSamplingConfig {

    private static final Logger log = LoggerFactory.getLogger(QuizSamplingConfig.class);

    @Bean
    public Random questionSamplingRandom(QuizProperties properties) {
        Long seed = properties.getSampling().getSeed();
        if (seed != null) {
            log.info("Question sampling uses fixed seed {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
