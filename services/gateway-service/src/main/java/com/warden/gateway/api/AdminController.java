package com.warden.gateway.api;

import com.warden.gateway.infrastructure.web.AuthorizationFilter;
import com.warden.security.CredentialStore;
import com.warden.security.Identity;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.PrivilegeGate;
import com.warden.security.PrivilegeLevel;
import com.warden.security.TokenService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * User maintenance for administrators. Both endpoints must be registered as ADMIN token routes;
 * the handlers check the level again before touching the store.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final CredentialStore credentialStore;
    private final TokenService tokenService;

    public AdminController(CredentialStore credentialStore, TokenService tokenService) {
        this.credentialStore = credentialStore;
        this.tokenService = tokenService;
    }

    public record DisableUserRequest(@NotBlank String userId) {
    }

    public record PrivilegeRequest(@NotBlank String userId, @NotNull @PositiveOrZero Integer level) {
    }

    /** Disables the user and revokes every refresh token they hold. 404 for an unknown user. */
    @PostMapping("/disable-user")
    public ResponseEntity<Void> disableUser(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity caller,
            @Valid @RequestBody DisableUserRequest request) {
        requireAdmin(caller);
        if (!credentialStore.disableUser(request.userId())) {
            return ResponseEntity.notFound().build();
        }
        tokenService.revokeAllRefreshTokens(request.userId());
        return ResponseEntity.noContent().build();
    }

    /** Takes effect on the user's next login or refresh. */
    @PostMapping("/privilege")
    public ResponseEntity<Void> updatePrivilege(
            @RequestAttribute(name = AuthorizationFilter.IDENTITY_ATTRIBUTE, required = false) Identity caller,
            @Valid @RequestBody PrivilegeRequest request) {
        requireAdmin(caller);
        credentialStore.updatePrivilege(request.userId(), PrivilegeLevel.of(request.level()));
        return ResponseEntity.noContent().build();
    }

    private static void requireAdmin(Identity caller) {
        if (caller == null) {
            throw new InvalidCredentialsException();
        }
        PrivilegeGate.authorize(caller.privilege(), PrivilegeLevel.ADMIN);
    }
}
