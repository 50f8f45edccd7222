package com.authgate.backend.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 3, max = 100) String username,
        // BCrypt ignores input past 72 bytes
        @NotBlank @Size(min = 8, max = 72) String password
) {}
