package com.nl2sql.profiler.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.nl2sql.profiler.model.ProfilingStage;

/** Unit tests for {@link GlobalExceptionHandler}. */
@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
    lenient().when(webRequest.getDescription(false)).thenReturn("uri=/api/datasets/profile");
  }

  @Nested
  @DisplayName("Profiling failures")
  class ProfilingFailures {

    @Test
    @DisplayName("Should map load failures to 400 with the stage")
    void shouldHandleDatasetLoadException() {
      // Given
      DatasetLoadException exception = new DatasetLoadException("File contains no data");

      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleDatasetLoadException(exception, webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage()).isEqualTo("File contains no data");
      assertThat(response.getBody().getStage()).isEqualTo("LOADING");
      assertThat(response.getBody().getPath()).isEqualTo("/api/datasets/profile");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should map schema failures to 422")
    void shouldHandleSchemaSynthesisException() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleSchemaSynthesisException(
              new SchemaSynthesisException("Cannot create a table without columns"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
      assertThat(response.getBody().getStatus()).isEqualTo(422);
      assertThat(response.getBody().getStage()).isEqualTo("SYNTHESIZING");
    }

    @Test
    @DisplayName("Should map cancelled runs to 409")
    void shouldHandleCancellation() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleProfilingCancelledException(
              new ProfilingCancelledException(ProfilingStage.ANALYZING), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.getBody().getMessage())
          .isEqualTo("Profiling run was cancelled during ANALYZING");
    }

    @Test
    @DisplayName("Should include the cause chain when debugging outside production")
    void shouldIncludeCauseChainInDebugMode() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      DatasetStoreException exception =
          new DatasetStoreException(
              "Failed to store rows of orders", new IOException("disk full"));

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleProfilingException(exception, webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getStage()).isEqualTo("STORING");
      assertThat(response.getBody().getDebugMessage())
          .isEqualTo("Failed to store rows of orders <- IOException: disk full");
    }

    @Test
    @DisplayName("Should hide the cause chain in production")
    void shouldHideCauseChainInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleProfilingException(
              new DatasetStoreException("Failed", new IOException("disk full")), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }

  @Nested
  @DisplayName("Request errors")
  class RequestErrors {

    @Test
    void shouldHandleIllegalArgumentException() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalArgumentException(
              new IllegalArgumentException("File is empty"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getError()).isEqualTo("Bad Request");
      assertThat(response.getBody().getMessage()).isEqualTo("File is empty");
      assertThat(response.getBody().getStage()).isNull();
    }

    @Test
    void shouldHandleResourceNotFoundException() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleResourceNotFoundException(
              new ResourceNotFoundException("Dataset not found: orders"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("Dataset not found: orders");
    }

    @Test
    void shouldHandleMaxUploadSizeExceeded() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleMaxUploadSizeExceeded(
              new MaxUploadSizeExceededException(1024), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
      assertThat(response.getBody().getMessage())
          .isEqualTo("File exceeds the maximum upload size");
    }

    @Test
    void shouldHandleUnsupportedMethod() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleHttpRequestMethodNotSupported(
              new HttpRequestMethodNotSupportedException("PUT"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
      assertThat(response.getBody().getMessage())
          .isEqualTo("Request method 'PUT' is not supported");
    }

    @Test
    void shouldDescribeMissingHandler() {
      NoHandlerFoundException exception =
          new NoHandlerFoundException("GET", "/api/unknown", new HttpHeaders());

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleNotFoundExceptions(exception, webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("No endpoint GET /api/unknown");
    }

    @Test
    void shouldAnswerQuietlyForIgnoredPaths() {
      when(webRequest.getDescription(false)).thenReturn("uri=/favicon.ico");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleNotFoundExceptions(
              new NoResourceFoundException(HttpMethod.GET, "favicon.ico"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("Resource not found");
    }
  }

  @Nested
  @DisplayName("Unexpected errors")
  class UnexpectedErrors {

    @Test
    @DisplayName("Should hide the message of unexpected errors")
    void shouldHandleGlobalException() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new RuntimeException("secret"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    void shouldExposeMessageWhenDebugging() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new RuntimeException("secret"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("secret");
    }
  }

  @Test
  void shouldRenderCauseChainWithoutMessages() {
    RuntimeException error = new RuntimeException("outer", new IllegalStateException());

    assertThat(GlobalExceptionHandler.causeChain(error))
        .isEqualTo("outer <- IllegalStateException");
  }
}
