package com.codeheadsystems.portcullis.client.manager;

import com.codeheadsystems.portcullis.client.accessor.IdentityServiceAccessor;
import com.codeheadsystems.portcullis.client.exceptions.PortcullisAccessorException;
import com.codeheadsystems.portcullis.client.model.Account;
import com.codeheadsystems.portcullis.model.account.PasswordChangeRequest;
import com.codeheadsystems.portcullis.model.account.PasswordResetRequest;
import com.codeheadsystems.portcullis.model.account.PasswordResetResponse;
import com.codeheadsystems.portcullis.model.account.VerificationEmailRequest;
import com.codeheadsystems.portcullis.model.account.VerificationEmailResponse;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password reset and email verification, the account flows that sit next to login.
 */
@Singleton
public class AccountWorkflowManager {

  private static final Logger log = LoggerFactory.getLogger(AccountWorkflowManager.class);

  private final IdentityServiceAccessor accessor;

  @Inject
  public AccountWorkflowManager(final IdentityServiceAccessor accessor) {
    log.info("AccountWorkflowManager()");
    this.accessor = accessor;
  }

  /**
   * Sends a password reset email.
   *
   * @param email the account email
   * @return the account the email went to
   */
  public Account sendPasswordResetEmail(final String email) {
    requireText(email, "email");
    log.debug("sendPasswordResetEmail()");
    return accountOf(accessor.passwordResetStart(new PasswordResetRequest(email)));
  }

  /**
   * Checks a password reset token from an email link.
   *
   * @param token the token
   * @return the account the token belongs to
   */
  public Account verifyPasswordResetToken(final String token) {
    requireText(token, "token");
    log.debug("verifyPasswordResetToken()");
    return accountOf(accessor.passwordResetToken(token));
  }

  /**
   * Sets a new password using a reset token.
   *
   * @param token       the token
   * @param newPassword the new password
   * @return the updated account
   */
  public Account resetPassword(final String token, final String newPassword) {
    requireText(token, "token");
    Objects.requireNonNull(newPassword, "newPassword");
    log.debug("resetPassword()");
    return accountOf(accessor.passwordResetFinish(token, new PasswordChangeRequest(newPassword)));
  }

  /**
   * Resends the verification email of an unverified account.
   *
   * @param login username or email
   * @return the service's acknowledgement
   */
  public VerificationEmailResponse resendVerificationEmail(final String login) {
    requireText(login, "login");
    log.debug("resendVerificationEmail()");
    return accessor.verificationEmail(new VerificationEmailRequest(login));
  }

  private static Account accountOf(PasswordResetResponse response) {
    if (response.account() == null) {
      throw new PortcullisAccessorException("Password reset response carried no account", null);
    }
    return Account.from(response.account());
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
  }
}
