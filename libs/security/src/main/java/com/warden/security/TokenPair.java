package com.warden.security;

/**
 * Access token plus refresh token, as returned by login and by refresh redemption.
 */
public record TokenPair(AccessToken accessToken, RefreshToken refreshToken) {
}
