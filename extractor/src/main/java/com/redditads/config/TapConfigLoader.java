package com.redditads.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and validates the tap config file. Missing required keys are reported together.
 */
@Component
@RequiredArgsConstructor
public class TapConfigLoader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public TapConfig load(Path path) {
        TapConfig config;
        try {
            config = objectMapper.readValue(path.toFile(), TapConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read config file " + path, e);
        }
        validate(config);
        return config;
    }

    void validate(TapConfig config) {
        Set<ConstraintViolation<TapConfig>> violations = validator.validate(config);
        if (violations.isEmpty()) {
            return;
        }
        Set<String> messages = new TreeSet<>();
        for (ConstraintViolation<TapConfig> v : violations) {
            messages.add(v.getMessage());
        }
        throw new IllegalArgumentException("Config is missing or has invalid keys: " + String.join(", ", messages));
    }
}
