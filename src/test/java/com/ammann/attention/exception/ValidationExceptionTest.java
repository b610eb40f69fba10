/* (C)2026 */
package com.ammann.attention.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void invalidParameterDescribesValueAndExpectation() {
        ValidationException exception =
                ValidationException.invalidParameter("granularity", "month", "hour, day or week");

        assertThat(exception)
                .isInstanceOf(ApiException.class)
                .hasMessage("Invalid parameter 'granularity': got 'month', expected hour, day or week");
    }

    @Test
    void missingParameterNamesTheParameter() {
        assertThat(ValidationException.missingParameter("domain"))
                .hasMessage("Missing required parameter 'domain'");
    }

    @Test
    void keepsCause() {
        IllegalStateException cause = new IllegalStateException("root");

        assertThat(new ValidationException("wrapped", cause)).hasCause(cause);
    }
}
