package com.phillippitts.resumeguard.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void resumeGuardExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        ResumeGuardException ex = new ResumeGuardException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void operationTimeoutShouldNameContextAndTimeout() {
        OperationTimeoutException ex = new OperationTimeoutException("expenses", 8_000);

        assertThat(ex.getMessage()).contains("expenses").contains("8000ms");
        assertThat(ex.getTimeoutMs()).isEqualTo(8_000);
    }

    @Test
    void allDomainExceptionsShareTheBase() {
        assertThat(new SessionRefreshException("refused")).isInstanceOf(ResumeGuardException.class);
        assertThat(new SessionExpiredException("expired")).isInstanceOf(ResumeGuardException.class);
        assertThat(new OperationTimeoutException("data", 1)).isInstanceOf(ResumeGuardException.class);
        assertThat(new ResumeGuardException("x")).isInstanceOf(RuntimeException.class);
    }
}
