package com.authgate.backend.auth.controller;

import com.authgate.backend.auth.dto.AuthResponse;
import com.authgate.backend.auth.dto.LoginRequest;
import com.authgate.backend.auth.dto.RefreshRequest;
import com.authgate.backend.auth.dto.RegisterRequest;
import com.authgate.backend.auth.dto.RegisterResponse;
import com.authgate.backend.auth.dto.ResendVerificationRequest;
import com.authgate.backend.auth.dto.StatusResponse;
import com.authgate.backend.auth.service.AuthService;
import com.authgate.backend.auth.service.EmailVerificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final EmailVerificationService emailVerification;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest req) {
        long userId = authService.registerNewUser(req.email(), req.username(), req.password());
        emailVerification.issue(userId, req.email());
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(userId));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
        return ResponseEntity.ok(AuthResponse.of(authService.login(req.email(), req.password(), req.appId())));
    }

    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshRequest req) {
        return ResponseEntity.ok(AuthResponse.of(authService.refresh(req.refreshToken())));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshRequest req) {
        authService.logout(req.refreshToken());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/verify")
    public ResponseEntity<StatusResponse> verify(@RequestParam("token") String token) {
        authService.verifyUser(token);
        return ResponseEntity.ok(StatusResponse.verified());
    }

    /** Same answer whether or not the address exists or is already verified. */
    @PostMapping("/verify/resend")
    public ResponseEntity<StatusResponse> resend(@Valid @RequestBody ResendVerificationRequest req) {
        emailVerification.resend(req.email());
        return ResponseEntity.ok(StatusResponse.ok());
    }
}
