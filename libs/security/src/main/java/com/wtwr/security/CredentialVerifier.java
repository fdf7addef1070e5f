package com.wtwr.security;

import com.wtwr.common.Result;

/**
 * Turns a raw credential into a {@link CallerIdentity}.
 * <p>
 * Implementations must be all-or-nothing: a forged, malformed or expired credential yields the
 * same {@code Unauthorized} error, and no identity is ever derived from part of a credential.
 */
public interface CredentialVerifier {

    Result<CallerIdentity> verify(String credential);
}
