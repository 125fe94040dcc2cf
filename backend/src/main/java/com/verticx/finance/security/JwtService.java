package com.verticx.finance.security;

import com.verticx.finance.user.AppUser;
import com.verticx.finance.user.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

@Service
public class JwtService {

    private static final String CLAIM_USER_ID = "uid";
    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_BRANCH_ID = "branchId";
    private static final String CLAIM_STUDENT_ID = "studentId";
    private static final String CLAIM_STAFF_ID = "staffId";

    private final SecretKey secretKey;
    private final int expirationMinutes;

    public JwtService(@Value("${app.security.jwtSecret}") String base64Secret,
                      @Value("${app.security.jwtExpirationMinutes}") int expirationMinutes) {
        this.secretKey = Keys.hmacShaKeyFor(Decoders.BASE64.decode(Base64Util.ensureBase64(base64Secret)));
        this.expirationMinutes = expirationMinutes;
    }

    public String generateToken(AppUser user) {
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(user.getUsername())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_BRANCH_ID, user.getBranchId())
                .claim(CLAIM_STUDENT_ID, user.getStudentId())
                .claim(CLAIM_STAFF_ID, user.getStaffId())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(expirationMinutes, ChronoUnit.MINUTES)))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Parses and verifies a token. Throws {@link io.jsonwebtoken.JwtException} when the token is
     * malformed, tampered with or expired.
     */
    public AuthenticatedPrincipal parsePrincipal(String token) {
        Claims claims = extractAllClaims(token);
        return new AuthenticatedPrincipal(
                toLong(claims.get(CLAIM_USER_ID)),
                claims.getSubject(),
                Role.valueOf(claims.get(CLAIM_ROLE, String.class)),
                toLong(claims.get(CLAIM_BRANCH_ID)),
                toLong(claims.get(CLAIM_STUDENT_ID)),
                toLong(claims.get(CLAIM_STAFF_ID)));
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(secretKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private static Long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    static class Base64Util {
        static String ensureBase64(String value) {
            try {
                Decoders.BASE64.decode(value);
                return value;
            } catch (Exception ex) {
                return java.util.Base64.getEncoder().encodeToString(value.getBytes());
            }
        }
    }
}
