package uk.gegc.trivia.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Single source of randomness for quiz question selection, replaceable in tests.
 */
@Configuration
public class RandomConfig {

    @Bean
    public Random quizRandom() {
        return new Random();
    }
}
