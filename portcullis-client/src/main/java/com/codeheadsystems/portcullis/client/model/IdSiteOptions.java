package com.codeheadsystems.portcullis.client.model;

/**
 * Options for an ID Site redirect.
 *
 * @param callbackUri where ID Site sends the user back; must be registered with the service
 * @param path        ID Site page to open, e.g. {@code /register}; empty for the default
 * @param state       opaque value echoed back in the callback
 * @param logout      true to end the ID Site session instead of logging in
 */
public record IdSiteOptions(String callbackUri, String path, String state, boolean logout) {

  public IdSiteOptions {
    path = path == null ? "" : path;
    state = state == null ? "" : state;
  }

  public static IdSiteOptions forCallback(final String callbackUri) {
    return new IdSiteOptions(callbackUri, "", "", false);
  }

  public IdSiteOptions withPath(final String path) {
    return new IdSiteOptions(callbackUri, path, state, logout);
  }

  public IdSiteOptions withState(final String state) {
    return new IdSiteOptions(callbackUri, path, state, logout);
  }

  public IdSiteOptions withLogout(final boolean logout) {
    return new IdSiteOptions(callbackUri, path, state, logout);
  }
}
