package io.taskvault.error;

public final class DecryptionFailedException extends TaskVaultException {
    private final String document;

    public DecryptionFailedException(String document, Throwable cause) {
        super("Document could not be decrypted: " + document, cause);
        this.document = document;
    }

    public String document() {
        return document;
    }
}
