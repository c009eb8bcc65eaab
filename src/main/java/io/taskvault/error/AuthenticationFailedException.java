package io.taskvault.error;

public final class AuthenticationFailedException extends TaskVaultException {
    public AuthenticationFailedException() {
        super("Authentication failed");
    }
}
