package com.warden.gateway.api;

import com.warden.gateway.infrastructure.web.AuthorizationFilter;
import com.warden.security.ApiKey;
import com.warden.security.CredentialStore;
import com.warden.security.Identity;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.PrivilegeLevel;
import com.warden.security.TokenPair;
import com.warden.security.TokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration, login, refresh rotation, logout, password change and API-key issuance.
 *
 * <p>{@code /api/auth/api-key} and {@code /api/auth/change-password} must be registered as token
 * routes; the caller's identity then arrives from {@link AuthorizationFilter}. The other endpoints are open and only rate-limited.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final CredentialStore credentialStore;
    private final TokenService tokenService;
    private final Clock clock;

    public AuthController(CredentialStore credentialStore, TokenService tokenService, Clock clock) {
        this.credentialStore = credentialStore;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    public record RegisterRequest(
            @NotBlank @Email String email,
            @NotBlank @Size(min = CredentialStore.MIN_SECRET_LENGTH, max = CredentialStore.MAX_SECRET_BYTES) String password) {

        @Override
        public String toString() {
            return "RegisterRequest[email=" + email + ", password=****]";
        }
    }

    public record RegisterResponse(String userId, String email) {
    }

    public record LoginRequest(@NotBlank String email, @NotBlank String password) {

        @Override
        public String toString() {
            return "LoginRequest[email=" + email + ", password=****]";
        }
    }

    public record RefreshRequest(@NotBlank String refreshToken) {

        @Override
        public String toString() {
            return "RefreshRequest[refreshToken=****]";
        }
    }

    public record ChangePasswordRequest(
            @NotBlank String currentPassword,
            @NotBlank @Size(min = CredentialStore.MIN_SECRET_LENGTH, max = CredentialStore.MAX_SECRET_BYTES) String newPassword) {

        @Override
        public String toString() {
            return "ChangePasswordRequest[currentPassword=****, newPassword=****]";
        }
    }

    public record TokenResponse(String accessToken, String refreshToken, String tokenType, long expiresIn) {
    }

    public record ApiKeyResponse(String apiKey) {
    }

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        String userId = credentialStore.createUser(request.email(), request.password(), PrivilegeLevel.USER);
        Identity identity = credentialStore.findActiveIdentity(userId)
                .orElseThrow(InvalidCredentialsException::new);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterResponse(identity.userId(), identity.email()));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        Identity identity = credentialStore.verifySecret(request.email(), request.password());
        return toResponse(tokenService.issueTokenPair(identity));
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest request) {
        return toResponse(tokenService.redeemRefreshToken(request.refreshToken()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshRequest request) {
        tokenService.revokeRefreshToken(request.refreshToken());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity,
            @Valid @RequestBody ChangePasswordRequest request) {
        credentialStore.changeSecret(requireIdentity(identity).userId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api-key")
    public ApiKeyResponse issueApiKey(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity identity) {
        ApiKey key = credentialStore.rotateApiKey(requireIdentity(identity).userId());
        return new ApiKeyResponse(key.value());
    }

    private static Identity requireIdentity(Identity identity) {
        if (identity == null) {
            throw new InvalidCredentialsException();
        }
        return identity;
    }

    private TokenResponse toResponse(TokenPair pair) {
        long expiresIn = Math.max(0, Duration.between(clock.instant(), pair.accessToken().expiresAt()).toSeconds());
        return new TokenResponse(pair.accessToken().value(), pair.refreshToken().value(), "Bearer", expiresIn);
    }
}
