package com.codeheadsystems.portcullis.client.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A username/password login attempt.
 *
 * @param identifier   username or email
 * @param secret       the password
 * @param accountStore store to authenticate against; null searches every mapped store
 */
public record CredentialRequest(String identifier, String secret, AccountStore accountStore) {

  public CredentialRequest {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(secret, "secret");
    if (identifier.isBlank()) {
      throw new IllegalArgumentException("identifier must not be blank");
    }
  }

  /**
   * Login attempt against all account stores mapped to the application.
   *
   * @param identifier the identifier
   * @param secret     the secret
   */
  public CredentialRequest(final String identifier, final String secret) {
    this(identifier, secret, null);
  }

  public Optional<AccountStore> accountStoreRef() {
    return Optional.ofNullable(accountStore);
  }

  @Override
  public String toString() {
    return "CredentialRequest[identifier=" + identifier + ", secret=****, accountStore=" + accountStore + "]";
  }
}
