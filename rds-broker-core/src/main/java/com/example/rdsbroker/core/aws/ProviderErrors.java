package com.example.rdsbroker.core.aws;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.rdsbroker.core.errors.NotFoundException;
import com.example.rdsbroker.core.errors.ProviderException;
import java.util.function.Supplier;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Translates SDK failures into the broker error taxonomy.
 *
 * <p>A 404 status or a provider {@code *NotFound} error code always becomes {@link
 * NotFoundException}, whatever the call. Everything else becomes {@link ProviderException} with
 * the provider's code and message preserved.
 */
public final class ProviderErrors {

  private static final System.Logger LOGGER = System.getLogger(ProviderErrors.class.getName());

  private ProviderErrors() {}

  /**
   * Runs a provider call, translating any {@link SdkException}.
   *
   * @param what short description used in error messages, e.g. {@code "describe db-1"}
   * @param call the SDK call
   * @param <T> result type
   * @return the call's result
   */
  public static <T> T call(final String what, final Supplier<T> call) {
    try {
      return call.get();
    } catch (final SdkException e) {
      throw translate(what, e);
    }
  }

  /** Variant of {@link #call(String, Supplier)} for calls whose result is not needed. */
  public static void run(final String what, final Runnable call) {
    call(
        what,
        () -> {
          call.run();
          return null;
        });
  }

  public static RuntimeException translate(final String what, final SdkException e) {
    LOGGER.log(DEBUG, "Provider call {0} failed: {1}", what, e.getMessage());
    if (e instanceof AwsServiceException service) {
      final var details = service.awsErrorDetails();
      final var code =
          details != null && details.errorCode() != null
              ? details.errorCode()
              : String.valueOf(service.statusCode());
      final var message =
          details != null && details.errorMessage() != null ? details.errorMessage() : e.getMessage();
      if (service.statusCode() == 404 || code.endsWith("NotFound") || code.endsWith("NotFoundFault")) {
        return new NotFoundException(what + ": " + message, e);
      }
      return new ProviderException(code, message, e);
    }
    return new ProviderException("ClientError", e.getMessage(), e);
  }
}
