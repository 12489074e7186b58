package com.fun.compute.api.service;

import com.fun.compute.api.config.ComputeProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class PasswordGenerator {

    // No 0/O or 1/l/I.
    private static final String SYMBOLS = "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public PasswordGenerator(ComputeProperties computeProperties) {
        this.length = computeProperties.getPasswordLength();
    }

    public String generate() {
        StringBuilder password = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            password.append(SYMBOLS.charAt(random.nextInt(SYMBOLS.length())));
        }
        return password.toString();
    }
}
