package com.codeheadsystems.portcullis.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.portcullis.client.accessor.IdentityServiceAccessor;
import com.codeheadsystems.portcullis.client.error.ApiError;
import com.codeheadsystems.portcullis.client.exceptions.PortcullisAccessorException;
import com.codeheadsystems.portcullis.client.exceptions.ServiceException;
import com.codeheadsystems.portcullis.client.model.AccountStore;
import com.codeheadsystems.portcullis.client.model.AuthenticationResult;
import com.codeheadsystems.portcullis.client.model.CredentialRequest;
import com.codeheadsystems.portcullis.model.account.AccountResponse;
import com.codeheadsystems.portcullis.model.account.AccountStoreReference;
import com.codeheadsystems.portcullis.model.account.LoginAttemptRequest;
import com.codeheadsystems.portcullis.model.account.LoginAttemptResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthenticationManagerTest {

  private static final AccountResponse ACCOUNT = new AccountResponse(
      "https://api.example.com/v1/accounts/acc1", "jdoe", "jdoe@example.com", "John", "Doe", "ENABLED");

  @Mock private IdentityServiceAccessor accessor;

  private AuthenticationManager manager;

  @BeforeEach
  void setUp() {
    manager = new AuthenticationManager(accessor);
  }

  @Test
  void authenticate_encodesCredentialsAsBasicValue() {
    when(accessor.loginAttempt(any())).thenReturn(new LoginAttemptResponse(ACCOUNT));

    AuthenticationResult result = manager.authenticate(new CredentialRequest("jdoe", "pässword"));

    assertThat(result.account().href()).isEqualTo(ACCOUNT.href());
    assertThat(result.account().email()).isEqualTo("jdoe@example.com");
    LoginAttemptRequest sent = sent();
    assertThat(sent.type()).isEqualTo("basic");
    assertThat(new String(Base64.getDecoder().decode(sent.value()), StandardCharsets.UTF_8))
        .isEqualTo("jdoe:pässword");
    assertThat(sent.accountStore()).isNull();
  }

  @Test
  void authenticate_pinnedHref_isSent() {
    when(accessor.loginAttempt(any())).thenReturn(new LoginAttemptResponse(ACCOUNT));
    String directory = "https://api.example.com/v1/directories/dir1";

    manager.authenticate(new CredentialRequest("jdoe", "secret", AccountStore.byHref(directory)));

    assertThat(sent().accountStore()).isEqualTo(new AccountStoreReference(directory, null));
  }

  @Test
  void authenticate_pinnedNameKey_isSent() {
    when(accessor.loginAttempt(any())).thenReturn(new LoginAttemptResponse(ACCOUNT));

    manager.authenticate(new CredentialRequest("jdoe", "secret", AccountStore.byNameKey("acme")));

    assertThat(sent().accountStore()).isEqualTo(new AccountStoreReference(null, "acme"));
  }

  @Test
  void authenticate_rejectedByPinnedStore_isNotRetried() {
    when(accessor.loginAttempt(any())).thenThrow(new ServiceException(
        new ApiError(400, 7104, "Invalid username or password.", "Login attempt failed because there is no Account "
            + "in the Application's associated Account Stores with the specified username or email.")));
    CredentialRequest request = new CredentialRequest("jdoe", "secret",
        AccountStore.byHref("https://api.example.com/v1/directories/other"));

    assertThatThrownBy(() -> manager.authenticate(request))
        .isInstanceOfSatisfying(ServiceException.class, e -> assertThat(e.code()).isEqualTo(7104));
    verify(accessor, times(1)).loginAttempt(any());
  }

  @Test
  void authenticate_responseWithoutAccount_isAccessorError() {
    when(accessor.loginAttempt(any())).thenReturn(new LoginAttemptResponse(null));

    assertThatThrownBy(() -> manager.authenticate(new CredentialRequest("jdoe", "secret")))
        .isInstanceOf(PortcullisAccessorException.class);
  }

  @Test
  void credentialRequest_neverPrintsSecret() {
    assertThat(new CredentialRequest("jdoe", "hunter2").toString()).doesNotContain("hunter2");
  }

  private LoginAttemptRequest sent() {
    ArgumentCaptor<LoginAttemptRequest> captor = ArgumentCaptor.forClass(LoginAttemptRequest.class);
    verify(accessor).loginAttempt(captor.capture());
    return captor.getValue();
  }
}
