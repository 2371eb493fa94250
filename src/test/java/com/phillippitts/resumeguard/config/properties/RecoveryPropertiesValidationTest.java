package com.phillippitts.resumeguard.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new RecoveryProperties())).isEmpty();
    }

    @Test
    void rejectsUnorderedThresholds() {
        RecoveryProperties p = new RecoveryProperties();
        p.getThresholds().setClearLoadingMs(200_000);

        Set<ConstraintViolation<RecoveryProperties>> violations = validator.validate(p);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .contains("Thresholds must satisfy log-only <= clear-loading <= stale");
    }

    @Test
    void rejectsZeroRefreshAttempts() {
        RecoveryProperties p = new RecoveryProperties();
        p.getSession().setMaxAttempts(0);

        assertThat(validator.validate(p)).extracting(ConstraintViolation::getMessage)
                .contains("At least one refresh attempt is required");
    }

    @Test
    void rejectsZeroRetries() {
        RecoveryProperties p = new RecoveryProperties();
        p.getRetry().setMaxRetries(0);

        assertThat(validator.validate(p)).extracting(ConstraintViolation::getMessage)
                .contains("Max retries must be at least 1");
    }

    @Test
    void rejectsEmptySignatureLists() {
        RecoveryProperties p = new RecoveryProperties();
        p.getRetry().setAuthSignatures(List.of());

        assertThat(validator.validate(p)).isNotEmpty();
    }

    @Test
    void rejectsNonPositiveSuppressionWindow() {
        RecoveryProperties p = new RecoveryProperties();
        p.getSuppression().setWindowMs(0);

        assertThat(validator.validate(p)).isNotEmpty();
    }
}
