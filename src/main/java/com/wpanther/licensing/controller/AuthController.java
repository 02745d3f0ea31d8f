package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.ChangePasswordRequest;
import com.wpanther.licensing.dto.ContextResponse;
import com.wpanther.licensing.dto.LoginRequest;
import com.wpanther.licensing.dto.LoginResponse;
import com.wpanther.licensing.dto.SignupRequest;
import com.wpanther.licensing.dto.SignupResponse;
import com.wpanther.licensing.dto.UserSummary;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Answers 201 when a company was created and 200 when the domain already belongs to one
     */
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        SignupResponse response = authService.signup(request);
        HttpStatus status = response.isDomainExists() ? HttpStatus.OK : HttpStatus.CREATED;
        return new ResponseEntity<>(response, status);
    }

    @GetMapping("/me")
    public ResponseEntity<ContextResponse> me(AuthorizationContext context) {
        ContextResponse.ContextResponseBuilder response = ContextResponse.builder()
                .user(UserSummary.from(context.getUser()))
                .companyId(context.getCompanyId())
                .companyName(context.getCompany().getName())
                .tenantId(context.getTenant() != null ? context.getTenant().getId() : null)
                .roles(context.getRoles())
                .permissions(context.getPermissions());
        if (context.getLicense() != null) {
            response.licenseStatus(context.getLicense().getStatus())
                    .licenseExpiresAt(context.getLicense().getExpiresAt())
                    .licenseFeatures(context.getLicense().getFeatures());
        }
        return ResponseEntity.ok(response.build());
    }

    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(AuthorizationContext context,
                                                              @Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(context.getUserId(), request.getCurrentPassword(), request.getNewPassword());
        return ResponseEntity.ok(Map.of("message", "Password changed successfully"));
    }
}
