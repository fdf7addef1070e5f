/**
 * Bearer credentials: where a request may carry one ({@link com.wtwr.security.CredentialLocator}),
 * how one is minted ({@link com.wtwr.security.JwtCredentialIssuer}) and how one is turned into a
 * {@link com.wtwr.security.CallerIdentity} ({@link com.wtwr.security.CredentialVerifier}).
 *
 * <p>Everything here is a pure function of its inputs plus an immutable
 * {@link com.wtwr.security.CredentialSettings}; instances are safe to share across request threads.
 */
package com.wtwr.security;
