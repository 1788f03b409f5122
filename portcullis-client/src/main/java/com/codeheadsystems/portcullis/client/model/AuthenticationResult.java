package com.codeheadsystems.portcullis.client.model;

/**
 * Outcome of a successful credential login.
 *
 * @param account the authenticated account
 */
public record AuthenticationResult(Account account) {
}
