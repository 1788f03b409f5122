package com.codeheadsystems.portcullis.client.model;

/**
 * Verified result of an ID Site callback.
 *
 * @param accountHref  the account (or, for some flows, application) href from {@code sub}
 * @param status       what happened on ID Site
 * @param state        the state passed when the flow started, or empty
 * @param isNewAccount true when the account was created during this flow
 */
public record IdSiteResult(String accountHref, IdSiteResultStatus status, String state, boolean isNewAccount) {
}
