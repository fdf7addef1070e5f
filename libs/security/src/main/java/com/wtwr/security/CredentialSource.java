package com.wtwr.security;

/** Where a credential was found, in lookup priority order. */
public enum CredentialSource {
    HEADER,
    QUERY,
    BODY
}
