package com.vcc.copilot.auth;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.error.AuthException;
import com.vcc.copilot.model.PortalPrincipal;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortalTokenVerifierTest {

    private static final String SECRET = "portal-copilot-test-secret-0123456789-abcdef";
    private static final Instant NOW = Instant.parse("2026-03-01T15:30:00Z");
    private static final UUID SUBJECT = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID TENANT = UUID.fromString("00000000-0000-0000-0000-0000000000f1");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private CopilotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CopilotProperties();
        properties.getAuth().setJwtSecret(SECRET);
    }

    private PortalTokenVerifier verifier() {
        return new PortalTokenVerifier(properties, clock);
    }

    private static SecretKey rawKey(String secret) {
        return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    private static JwtBuilder token() {
        return Jwts.builder()
                .subject(SUBJECT.toString())
                .issuedAt(Date.from(NOW.minus(Duration.ofMinutes(5))))
                .expiration(Date.from(NOW.plus(Duration.ofHours(1))));
    }

    @Test
    void validTokenYieldsPrincipal() {
        String jwt = token().claim("tenant_id", TENANT.toString()).claim("role", "owner")
                .signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        PortalPrincipal principal = verifier().verify(jwt);

        assertThat(principal.getSubjectId()).isEqualTo(SUBJECT);
        assertThat(principal.getTenantId()).isEqualTo(TENANT);
        assertThat(principal.getRole()).isEqualTo("owner");
    }

    @Test
    void roleDefaultsToClientAndTenantFallsBackToOrgId() {
        String jwt = token().claim("org_id", TENANT.toString()).signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        PortalPrincipal principal = verifier().verify(jwt);

        assertThat(principal.getTenantId()).isEqualTo(TENANT);
        assertThat(principal.getRole()).isEqualTo("client");
    }

    @Test
    void tokenWithoutTenantHasNullTenant() {
        String jwt = token().signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        assertThat(verifier().verify(jwt).getTenantId()).isNull();
    }

    @Test
    void expiredTokenIsRejected() {
        String jwt = token().expiration(Date.from(NOW.minus(Duration.ofMinutes(1))))
                .signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        assertReason(jwt, AuthException.Reason.EXPIRED);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        String jwt = token().signWith(rawKey("some-other-secret-that-is-long-enough-0123456789"), Jwts.SIG.HS256)
                .compact();

        assertReason(jwt, AuthException.Reason.INVALID_SIGNATURE);
    }

    @Test
    void garbageIsMalformed() {
        assertReason("not.a.jwt", AuthException.Reason.MALFORMED);
        assertReason("definitely-not-a-token", AuthException.Reason.MALFORMED);
    }

    @Test
    void blankCredentialIsMissing() {
        assertReason("  ", AuthException.Reason.MISSING_CREDENTIAL);
        assertReason(null, AuthException.Reason.MISSING_CREDENTIAL);
    }

    @Test
    void subjectMustBePresentAndAnId() {
        String noSubject = Jwts.builder()
                .expiration(Date.from(NOW.plus(Duration.ofHours(1))))
                .claim("tenant_id", TENANT.toString())
                .signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();
        String badSubject = token().subject("alice@example.com").signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        assertReason(noSubject, AuthException.Reason.MISSING_CLAIM);
        assertReason(badSubject, AuthException.Reason.MISSING_CLAIM);
    }

    @Test
    void issuerIsCheckedWhenConfigured() {
        properties.getAuth().setIssuer("portal");
        String wrongIssuer = token().issuer("someone-else").signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();
        String rightIssuer = token().issuer("portal").signWith(rawKey(SECRET), Jwts.SIG.HS256).compact();

        assertReason(wrongIssuer, AuthException.Reason.MALFORMED);
        assertThat(verifier().verify(rightIssuer).getSubjectId()).isEqualTo(SUBJECT);
    }

    @Test
    void base64SecretIsDecoded() {
        byte[] keyBytes = new byte[32];
        for (int i = 0; i < keyBytes.length; i++) {
            keyBytes[i] = (byte) (i * 7 + 3);
        }
        properties.getAuth().setJwtSecret(Base64.getEncoder().encodeToString(keyBytes));
        String jwt = token().signWith(new SecretKeySpec(keyBytes, "HmacSHA256"), Jwts.SIG.HS256).compact();

        assertThat(verifier().verify(jwt).getSubjectId()).isEqualTo(SUBJECT);
    }

    private void assertReason(String jwt, AuthException.Reason reason) {
        PortalTokenVerifier verifier = verifier();
        assertThatThrownBy(() -> verifier.verify(jwt))
                .isInstanceOfSatisfying(AuthException.class, e -> assertThat(e.getAuthReason()).isEqualTo(reason));
    }
}
