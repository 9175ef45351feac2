package com.demoBank.onboarding.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Salted, slow hashing for login PINs.
 */
@Configuration
public class PinHashingConfig {

    @Bean
    public PasswordEncoder pinEncoder(@Value("${onboarding.pin.bcrypt-strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
