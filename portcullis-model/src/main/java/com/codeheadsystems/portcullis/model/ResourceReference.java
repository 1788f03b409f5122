package com.codeheadsystems.portcullis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Link to another resource of the identity service. Only the href is carried; the library
 * never dereferences it on its own.
 *
 * @param href the fully-qualified resource href
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceReference(@JsonProperty("href") String href) {
}
