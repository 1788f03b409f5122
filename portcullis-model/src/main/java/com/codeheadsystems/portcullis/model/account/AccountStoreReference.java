package com.codeheadsystems.portcullis.model.account;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account store selector sent with a login attempt. Exactly one of the two fields is set.
 *
 * @param href    href of a directory, group or organization
 * @param nameKey name key of an organization
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountStoreReference(
    @JsonProperty("href") String href,
    @JsonProperty("nameKey") String nameKey) {
}
