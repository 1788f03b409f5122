package com.codeheadsystems.portcullis.client.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.portcullis.model.account.AccountStoreReference;
import com.codeheadsystems.portcullis.model.oauth.AccessTokenResponse;
import org.junit.jupiter.api.Test;

class ModelTest {

  @Test
  void accountStore_exactlyOneOfHrefOrNameKey() {
    assertThatThrownBy(() -> new AccountStore(null, null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new AccountStore("https://x/v1/directories/d", "acme"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(AccountStore.byNameKey("acme").toReference()).isEqualTo(new AccountStoreReference(null, "acme"));
  }

  @Test
  void credentialRequest_blankIdentifier_isRejected() {
    assertThatThrownBy(() -> new CredentialRequest(" ", "secret")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new CredentialRequest("jdoe", null)).isInstanceOf(NullPointerException.class);
    assertThat(new CredentialRequest("jdoe", "secret").accountStoreRef()).isEmpty();
  }

  @Test
  void idSiteOptions_defaults() {
    IdSiteOptions options = IdSiteOptions.forCallback("https://myapp.example.com/callback");

    assertThat(options.path()).isEmpty();
    assertThat(options.state()).isEmpty();
    assertThat(options.logout()).isFalse();
    assertThat(options.withPath(null).path()).isEmpty();
    assertThat(options.withLogout(true).callbackUri()).isEqualTo("https://myapp.example.com/callback");
  }

  @Test
  void idSiteResultStatus_fromClaim() {
    assertThat(IdSiteResultStatus.fromClaim("LOGOUT")).contains(IdSiteResultStatus.LOGOUT);
    assertThat(IdSiteResultStatus.fromClaim("logout")).isEmpty();
    assertThat(IdSiteResultStatus.fromClaim(null)).isEmpty();
  }

  @Test
  void accessToken_missingExpiresIn_isZero() {
    assertThat(AccessToken.from(new AccessTokenResponse("at", "rt", "Bearer", null, null)).expiresIn()).isZero();
  }
}
