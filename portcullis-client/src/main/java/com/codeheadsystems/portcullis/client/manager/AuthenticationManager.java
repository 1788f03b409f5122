package com.codeheadsystems.portcullis.client.manager;

import com.codeheadsystems.portcullis.client.accessor.IdentityServiceAccessor;
import com.codeheadsystems.portcullis.client.exceptions.PortcullisAccessorException;
import com.codeheadsystems.portcullis.client.model.Account;
import com.codeheadsystems.portcullis.client.model.AccountStore;
import com.codeheadsystems.portcullis.client.model.AuthenticationResult;
import com.codeheadsystems.portcullis.client.model.CredentialRequest;
import com.codeheadsystems.portcullis.model.account.LoginAttemptRequest;
import com.codeheadsystems.portcullis.model.account.LoginAttemptResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Username/password authentication against the application's account stores.
 * <p>
 * When the request names an account store, the attempt is sent pinned to that store and the
 * service's answer is final. A rejected pinned attempt is never retried unpinned.
 */
@Singleton
public class AuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  private final IdentityServiceAccessor accessor;

  @Inject
  public AuthenticationManager(final IdentityServiceAccessor accessor) {
    log.info("AuthenticationManager()");
    this.accessor = accessor;
  }

  /**
   * Authenticates the account.
   *
   * @param request the credentials
   * @return the authentication result with the account expanded
   * @throws com.codeheadsystems.portcullis.client.exceptions.ServiceException if the service
   *                                                                           rejects the credentials
   */
  public AuthenticationResult authenticate(final CredentialRequest request) {
    Objects.requireNonNull(request, "request");
    log.debug("authenticate({})", request);
    String value = Base64.getEncoder().encodeToString(
        (request.identifier() + ":" + request.secret()).getBytes(StandardCharsets.UTF_8));
    LoginAttemptRequest attempt = new LoginAttemptRequest(
        LoginAttemptRequest.BASIC,
        value,
        request.accountStoreRef().map(AccountStore::toReference).orElse(null));

    LoginAttemptResponse response = accessor.loginAttempt(attempt);
    if (response.account() == null) {
      throw new PortcullisAccessorException("Login attempt response carried no account", null);
    }
    return new AuthenticationResult(Account.from(response.account()));
  }
}
