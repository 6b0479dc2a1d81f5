package com.nchat.connectors.vault;

/** Thrown when credentials cannot be encrypted, or a blob cannot be authenticated and decoded. */
public class CredentialEncryptionException extends Exception {
    public CredentialEncryptionException(String message)                  { super(message); }
    public CredentialEncryptionException(String message, Throwable cause) { super(message, cause); }
}
