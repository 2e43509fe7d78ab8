package warden.core.service.account;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import warden.core.model.auth.AuthException;

@DisplayName("PasswordPolicy")
class PasswordPolicyTest {

    private final PasswordPolicy policy = new PasswordPolicy(8);

    @Test
    @DisplayName("should accept a password meeting every rule")
    void shouldAcceptValidPassword() {
        assertDoesNotThrow(() -> policy.validate("Password123"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Pass1", "password123", "PASSWORD123", "Passwordabc"})
    @DisplayName("should reject weak passwords")
    void shouldRejectWeakPasswords(String password) {
        assertThrows(AuthException.InvalidPassword.class, () -> policy.validate(password));
    }
}
