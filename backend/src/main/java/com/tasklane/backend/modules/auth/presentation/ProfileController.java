package com.tasklane.backend.modules.auth.presentation;

import com.tasklane.backend.global.security.CallerIdentity;
import com.tasklane.backend.modules.auth.application.AuthService;
import com.tasklane.backend.modules.auth.presentation.dto.AccountResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Current account profile")
    @GetMapping("/profile/me")
    public ResponseEntity<AccountResponse> currentAccount(@AuthenticationPrincipal CallerIdentity caller) {
        return ResponseEntity.ok(authService.loadProfile(caller));
    }
}
