package com.codeheadsystems.portcullis.client.model;

import com.codeheadsystems.portcullis.model.account.AccountResponse;

/**
 * An account as returned inline by the identity service.
 *
 * @param href      the href
 * @param username  the username
 * @param email     the email
 * @param givenName the given name
 * @param surname   the surname
 * @param status    the status
 */
public record Account(String href, String username, String email, String givenName, String surname,
                      String status) {

  public static Account from(final AccountResponse response) {
    return new Account(response.href(), response.username(), response.email(), response.givenName(),
        response.surname(), response.status());
  }
}
