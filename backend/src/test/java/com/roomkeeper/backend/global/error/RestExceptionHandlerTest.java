package com.roomkeeper.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.server.ResponseStatusException;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();

    @Test
    @DisplayName("problem exceptions keep their code and detail")
    void problemException() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/checkin/locations/x/capacity");

        ResponseEntity<ProblemResponse> response = handler.handleProblemException(
                new ProblemException(HttpStatus.NOT_FOUND, "LOCATION_NOT_FOUND", "Location not found"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isNull();
        ProblemResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.code()).isEqualTo("LOCATION_NOT_FOUND");
        assertThat(body.type()).isEqualTo("urn:problem:roomkeeper:location_not_found");
        assertThat(body.detail()).isEqualTo("Location not found");
        assertThat(body.instance()).isEqualTo("/checkin/locations/x/capacity");
        assertThat(body.status()).isEqualTo(404);
    }

    @Test
    @DisplayName("retryable problems carry a Retry-After header")
    void retryableProblem() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/checkin/checkin");

        ResponseEntity<ProblemResponse> response = handler.handleProblemException(
                new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, "LOCATION_BUSY", "Try again", 2L),
                request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
    }

    @Test
    @DisplayName("a detail-less problem falls back to its code")
    void detailFallsBackToCode() {
        ProblemException ex = new ProblemException(HttpStatus.CONFLICT, "AUTHORIZED_PICKUP_EXISTS");

        assertThat(ex.getDetailMessage()).isEqualTo("AUTHORIZED_PICKUP_EXISTS");
        assertThat(ex.getMessage()).isEqualTo("AUTHORIZED_PICKUP_EXISTS: AUTHORIZED_PICKUP_EXISTS");
    }

    @Test
    @DisplayName("plain response status exceptions use the reason as code")
    void responseStatusException() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/checkin/record-pickup");

        ResponseEntity<ProblemResponse> response = handler.handleResponseStatusException(
                new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("UNAUTHORIZED");
    }

    @Test
    @DisplayName("unexpected exceptions are hidden behind a generic 500")
    void unexpectedException() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/checkin/history");

        ResponseEntity<ProblemResponse> response = handler.handleGenericException(
                new IllegalStateException("connection reset"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("internal_error");
        assertThat(response.getBody().detail()).isEqualTo("Unexpected server error");
    }
}
