package com.authgate.backend.auth.store;

public interface CredentialStore extends CredentialReader, CredentialWriter {
}
