package com.codeheadsystems.portcullis.client.model;

import com.codeheadsystems.portcullis.model.account.AccountStoreReference;
import java.util.Objects;

/**
 * The account store a login attempt is pinned to: a directory, group or organization by href,
 * or an organization by its name key.
 *
 * @param href    the store href, or null
 * @param nameKey the organization name key, or null
 */
public record AccountStore(String href, String nameKey) {

  public AccountStore {
    if ((href == null) == (nameKey == null)) {
      throw new IllegalArgumentException("Exactly one of href or nameKey must be set");
    }
  }

  public static AccountStore byHref(final String href) {
    return new AccountStore(Objects.requireNonNull(href, "href"), null);
  }

  public static AccountStore byNameKey(final String nameKey) {
    return new AccountStore(null, Objects.requireNonNull(nameKey, "nameKey"));
  }

  public AccountStoreReference toReference() {
    return new AccountStoreReference(href, nameKey);
  }
}
