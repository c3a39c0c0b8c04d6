package com.flagship.mining_ledger.auth;

import com.flagship.mining_ledger.account.dto.ProfileResponse;
import com.flagship.mining_ledger.auth.dto.AuthResponse;
import com.flagship.mining_ledger.auth.dto.LoginRequest;
import com.flagship.mining_ledger.auth.dto.SignupRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/signup")
    public ResponseEntity<AuthResponse> signup(@Valid @RequestBody SignupRequest request) {
        AuthSession session = authService.signup(request.getUsername(), request.getPassword(),
                request.getReferCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request) {
        return toResponse(authService.login(request.getUsername(), request.getPassword()));
    }

    private static AuthResponse toResponse(AuthSession session) {
        return new AuthResponse(true, session.getToken(), ProfileResponse.from(session.getAccount()));
    }
}
