package com.scholary.dubbing.error;

/**
 * A call to an external provider (transcription, translation, synthesis, object storage) failed.
 *
 * <p>The provider name is kept separately so the message can stay the provider's own diagnostic
 * text.
 */
public class UpstreamException extends DubbingException {

  private final String provider;

  public UpstreamException(String provider, String message) {
    super(message);
    this.provider = provider;
  }

  public UpstreamException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
