package com.flamingo.ai.roadmap.service.generation.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ProviderErrorClassifierTest {

  private final ProviderErrorClassifier classifier = new ProviderErrorClassifier();

  @Test
  void shouldClassifyAuthenticationFailure() {
    assertThat(classifier.classify(new AuthenticationException("Incorrect API key provided")))
        .isEqualTo(ProviderFailureKind.AUTH_FAILURE);
  }

  @Test
  void shouldClassifyRateLimit() {
    assertThat(classifier.classify(new RateLimitException("Rate limit reached for requests")))
        .isEqualTo(ProviderFailureKind.RATE_LIMITED);
  }

  @Test
  void shouldClassifyQuota_whenRateLimitMentionsInsufficientQuota() {
    RateLimitException error =
        new RateLimitException(
            "{\"error\":{\"code\":\"insufficient_quota\",\"message\":\"You exceeded your current"
                + " quota\"}}");

    assertThat(classifier.classify(error)).isEqualTo(ProviderFailureKind.QUOTA_EXHAUSTED);
  }

  @Test
  void shouldClassifyServerErrorsAndTimeoutsAsTransient() {
    assertThat(classifier.classify(new InternalServerException("Bad gateway")))
        .isEqualTo(ProviderFailureKind.TRANSIENT);
    assertThat(
            classifier.classify(
                new UncheckedIOException(new SocketTimeoutException("Read timed out"))))
        .isEqualTo(ProviderFailureKind.TRANSIENT);
  }

  @Test
  void shouldInspectCauseChain() {
    RuntimeException wrapped =
        new RuntimeException("call failed", new AuthenticationException("invalid key"));

    assertThat(classifier.classify(wrapped)).isEqualTo(ProviderFailureKind.AUTH_FAILURE);
  }

  @Test
  void shouldDefaultToTransient_whenUnknown() {
    assertThat(classifier.classify(new IllegalStateException("something odd")))
        .isEqualTo(ProviderFailureKind.TRANSIENT);
  }

  @Test
  void shouldClassifyRejectedRequest_whenWrappedByModelException() {
    RuntimeException wrapped =
        new RuntimeException(
            "The model `gpt-x` does not exist", new HttpException(404, "model_not_found"));

    assertThat(classifier.classify(wrapped)).isEqualTo(ProviderFailureKind.REQUEST_REJECTED);
  }

  @ParameterizedTest
  @CsvSource({
    "401, AUTH_FAILURE",
    "403, AUTH_FAILURE",
    "402, QUOTA_EXHAUSTED",
    "429, RATE_LIMITED",
    "500, TRANSIENT",
    "503, TRANSIENT",
    "408, TRANSIENT",
    "400, REQUEST_REJECTED",
    "404, REQUEST_REJECTED",
    "422, REQUEST_REJECTED"
  })
  void shouldMapHttpStatusCodes(int status, ProviderFailureKind expected) {
    assertThat(classifier.classify(new HttpException(status, "status " + status)))
        .isEqualTo(expected);
  }
}
