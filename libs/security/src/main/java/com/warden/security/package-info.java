/**
 * The Warden authorization pipeline.
 * <p>
 * {@link com.warden.security.RequestMediator} sequences {@link com.warden.security.RateLimiter},
 * credential resolution ({@link com.warden.security.PasswordVerifier},
 * {@link com.warden.security.TokenService} or {@link com.warden.security.CredentialStore}) and
 * {@link com.warden.security.PrivilegeGate}. Persistence is reached only through the
 * {@link com.warden.security.CredentialRepository} and
 * {@link com.warden.security.RefreshTokenRepository} ports.
 */
package com.warden.security;
