package com.vcc.copilot.auth;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.error.AuthException;
import com.vcc.copilot.error.AuthException.Reason;
import com.vcc.copilot.model.PortalPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies portal bearer credentials (HS256 JWT) and extracts the principal.
 * Pure in-process work: signature and expiry checks against the configured secret, no I/O.
 */
@Component
public class PortalTokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(PortalTokenVerifier.class);

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String FALLBACK_TENANT_CLAIM = "org_id";
    private static final String ROLE_CLAIM = "role";
    private static final String DEFAULT_ROLE = "client";

    private final JwtParser parser;
    private final String tenantClaim;

    public PortalTokenVerifier(CopilotProperties properties, Clock clock) {
        CopilotProperties.AuthConfig authConfig = properties.getAuth();
        SecretKey key = secretKey(authConfig.getJwtSecret());

        JwtParserBuilder builder = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()));
        if (authConfig.getIssuer() != null && !authConfig.getIssuer().isBlank()) {
            builder.requireIssuer(authConfig.getIssuer());
        }
        this.parser = builder.build();
        this.tenantClaim = authConfig.getTenantClaim() != null ? authConfig.getTenantClaim() : "tenant_id";

        log.info("PortalTokenVerifier initialized: issuerCheck={}, tenantClaim={}",
                authConfig.getIssuer() != null, tenantClaim);
    }

    /**
     * Verify a raw bearer token (without the "Bearer " prefix).
     *
     * @throws AuthException when the token is malformed, badly signed, expired or lacks a subject
     */
    public PortalPrincipal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(Reason.MISSING_CREDENTIAL, "Missing credential");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(Reason.EXPIRED, "Credential expired", e);
        } catch (SignatureException e) {
            throw new AuthException(Reason.INVALID_SIGNATURE, "Credential signature invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(Reason.MALFORMED, "Credential malformed", e);
        }

        UUID subjectId = uuidClaim(claims.getSubject(), "sub");
        if (subjectId == null) {
            throw new AuthException(Reason.MISSING_CLAIM, "Credential has no subject");
        }

        String tenantValue = stringClaim(claims, tenantClaim);
        if (tenantValue == null) {
            tenantValue = stringClaim(claims, FALLBACK_TENANT_CLAIM);
        }
        UUID tenantId = uuidClaim(tenantValue, tenantClaim);

        String role = stringClaim(claims, ROLE_CLAIM);
        return new PortalPrincipal(subjectId, tenantId, role != null ? role : DEFAULT_ROLE);
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }

    private UUID uuidClaim(String value, String claimName) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthException(Reason.MISSING_CLAIM, "Claim " + claimName + " is not a valid id", e);
        }
    }

    static SecretKey secretKey(String secret) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
