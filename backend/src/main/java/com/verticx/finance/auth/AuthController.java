package com.verticx.finance.auth;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.JwtService;
import com.verticx.finance.user.AppUser;
import com.verticx.finance.user.AppUserRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthenticationManager authenticationManager;
    private final JwtService jwtService;
    private final AppUserRepository appUserRepository;

    public AuthController(AuthenticationManager authenticationManager, JwtService jwtService,
                          AppUserRepository appUserRepository) {
        this.authenticationManager = authenticationManager;
        this.jwtService = jwtService;
        this.appUserRepository = appUserRepository;
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest request) {
        try {
            authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(request.username().toLowerCase(), request.password()));
        } catch (AuthenticationException ex) {
            throw new BusinessRuleException(ErrorCode.AUTHENTICATION_FAILED, "Invalid credentials", ex);
        }
        AppUser user = appUserRepository.findByUsernameIgnoreCase(request.username()).orElseThrow();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", jwtService.generateToken(user));
        body.put("fullName", user.getFullName());
        body.put("role", user.getRole());
        body.put("branchId", user.getBranchId());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/me")
    public ResponseEntity<AuthenticatedPrincipal> me(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(principal);
    }

    public record LoginRequest(@NotBlank String username, @NotBlank String password) {}
}
