package com.phiprotection.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Login credentials.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Size(max = 128)
    private String username;

    @NotBlank
    @Size(max = 256)
    private String password;

    @Override
    public String toString() {
        return "LoginRequest{username=" + username + ", password=[REDACTED]}";
    }
}
