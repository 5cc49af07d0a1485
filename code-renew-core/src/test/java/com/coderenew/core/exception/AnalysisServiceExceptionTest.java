package com.coderenew.core.exception;

import com.coderenew.core.exception.AnalysisServiceException.Failure;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalysisServiceException} status classification.
 */
class AnalysisServiceExceptionTest {

    @ParameterizedTest
    @CsvSource({
        "429, RATE_LIMITED, true, false",
        "401, AUTHENTICATION, false, true",
        "403, AUTHENTICATION, false, true",
        "408, TIMEOUT, true, false",
        "500, SERVER_ERROR, true, false",
        "529, SERVER_ERROR, true, false",
        "400, BAD_REQUEST, false, true",
        "404, BAD_REQUEST, false, true"
    })
    void classify_status_mapsToFailureKind(int status, Failure expected, boolean retryable, boolean clientError) {
        AnalysisServiceException exception = new AnalysisServiceException(AnalysisServiceException.classify(status), status, "x");

        assertThat(exception.getFailure()).isEqualTo(expected);
        assertThat(exception.isRetryable()).isEqualTo(retryable);
        assertThat(exception.isClientError()).isEqualTo(clientError);
        assertThat(exception.getErrorCode()).isEqualTo(AnalysisServiceException.ERROR_CODE);
    }

    @ParameterizedTest
    @EnumSource(Failure.class)
    void indicatesServiceFailure_onlyForServiceSideFailures(Failure failure) {
        AnalysisServiceException exception = new AnalysisServiceException(failure, 200, "x");

        boolean answered = failure == Failure.AUTHENTICATION
            || failure == Failure.BAD_REQUEST
            || failure == Failure.MALFORMED_RESPONSE;
        assertThat(exception.indicatesServiceFailure()).isEqualTo(!answered);
    }
}
