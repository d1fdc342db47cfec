package com.flamingo.ai.roadmap.service.generation.session;

import com.flamingo.ai.roadmap.domain.enums.ProviderFailureKind;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import java.io.IOException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps exceptions raised by the LangChain4j chat model to a {@link ProviderFailureKind}.
 *
 * <p>The whole cause chain is inspected. OpenAI-compatible endpoints report an empty balance as a
 * 429 with an {@code insufficient_quota} code, so quota markers are checked before rate limits.
 * Other 4xx responses are rejected requests and are not retried. Anything unrecognised is treated
 * as transient.
 */
@Component
public class ProviderErrorClassifier {

  private static final String[] QUOTA_MARKERS = {
    "insufficient_quota", "quota exceeded", "exceeded your current quota", "insufficient balance"
  };

  public ProviderFailureKind classify(Throwable error) {
    if (mentionsQuota(error)) {
      return ProviderFailureKind.QUOTA_EXHAUSTED;
    }
    for (Throwable t = error; t != null; t = next(t)) {
      if (t instanceof AuthenticationException) {
        return ProviderFailureKind.AUTH_FAILURE;
      }
      if (t instanceof RateLimitException) {
        return ProviderFailureKind.RATE_LIMITED;
      }
      if (t instanceof TimeoutException || t instanceof InternalServerException) {
        return ProviderFailureKind.TRANSIENT;
      }
      if (t instanceof HttpException http) {
        return fromStatusCode(http.statusCode());
      }
      if (t instanceof IOException) {
        return ProviderFailureKind.TRANSIENT;
      }
    }
    return ProviderFailureKind.TRANSIENT;
  }

  ProviderFailureKind fromStatusCode(int statusCode) {
    return switch (statusCode) {
      case 401, 403 -> ProviderFailureKind.AUTH_FAILURE;
      case 402 -> ProviderFailureKind.QUOTA_EXHAUSTED;
      case 429 -> ProviderFailureKind.RATE_LIMITED;
      case 408, 409 -> ProviderFailureKind.TRANSIENT;
      default ->
          statusCode >= 400 && statusCode < 500
              ? ProviderFailureKind.REQUEST_REJECTED
              : ProviderFailureKind.TRANSIENT;
    };
  }

  private boolean mentionsQuota(Throwable error) {
    for (Throwable t = error; t != null; t = next(t)) {
      String message = t.getMessage();
      if (message == null) {
        continue;
      }
      String lower = message.toLowerCase(Locale.ROOT);
      for (String marker : QUOTA_MARKERS) {
        if (lower.contains(marker)) {
          return true;
        }
      }
    }
    return false;
  }

  private static Throwable next(Throwable t) {
    Throwable cause = t.getCause();
    return cause == t ? null : cause;
  }
}
