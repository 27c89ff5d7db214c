package com.example.baldnessdetector.controller;

import com.example.baldnessdetector.dto.request.EmailAuthRequest;
import com.example.baldnessdetector.dto.request.GoogleAuthRequest;
import com.example.baldnessdetector.dto.response.AuthResponse;
import com.example.baldnessdetector.dto.response.UserResponse;
import com.example.baldnessdetector.helper.UserHelper;
import com.example.baldnessdetector.service.AuthService;
import jakarta.validation.Valid;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class AuthController {
    AuthService authService;
    UserHelper userHelper;

    /**
     * Login with a Google OAuth access token, optionally cross-checked against an ID token.
     */
    @PostMapping("/google")
    public ResponseEntity<AuthResponse> loginWithGoogle(@Valid @RequestBody GoogleAuthRequest req) {
        return ResponseEntity.ok(authService.loginWithGoogle(req));
    }

    @PostMapping("/email")
    public ResponseEntity<AuthResponse> loginWithEmail(@Valid @RequestBody EmailAuthRequest req) {
        return ResponseEntity.ok(authService.loginWithEmail(req));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(authService.getCurrentUser(userHelper.getCurrentUserId()));
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", "authentication");
    }
}
