package com.taskrunner.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.security.SignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    private static final String SECRET = "taskrunner-test-secret-must-be-at-least-32-bytes-long";
    private static final int EXPIRATION_SECONDS = 600;

    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        service = new JwtTokenService(SECRET, EXPIRATION_SECONDS);
    }

    @Nested
    @DisplayName("token generation")
    class GenerateTokenTests {

        @Test
        @DisplayName("callback tokens carry the task and workspace")
        void callbackClaims() {
            Claims claims = service.validateToken(service.generateCallbackToken("t-001", "ws-001"));

            assertEquals("t-001", claims.getSubject());
            assertEquals("ws-001", claims.get("workspaceId", String.class));
            assertTrue(claims.getAudience().contains(JwtTokenService.CALLBACK_AUDIENCE));
            assertNotNull(claims.getIssuedAt());
            assertNotNull(claims.getExpiration());
        }

        @Test
        @DisplayName("node tokens carry the node and its owner")
        void nodeClaims() {
            Claims claims = service.validateToken(service.generateNodeToken("n-001", "alice"));

            assertEquals("n-001", claims.getSubject());
            assertEquals("alice", claims.get("userId", String.class));
            assertTrue(claims.getAudience().contains(JwtTokenService.NODE_AUDIENCE));
        }
    }

    @Nested
    @DisplayName("validateToken")
    class ValidateTokenTests {

        @Test
        @DisplayName("throws on expired token")
        void throwsOnExpiredToken() {
            JwtTokenService shortLivedService = new JwtTokenService(SECRET, 0);
            String token = shortLivedService.generateCallbackToken("t-001", "ws-001");

            assertThrows(ExpiredJwtException.class, () -> service.validateToken(token));
        }

        @Test
        @DisplayName("throws on invalid signature")
        void throwsOnInvalidSignature() {
            String token = service.generateCallbackToken("t-001", "ws-001");
            JwtTokenService otherService = new JwtTokenService(
                    "a-completely-different-secret-key-at-least-32-bytes", EXPIRATION_SECONDS);

            assertThrows(SignatureException.class, () -> otherService.validateToken(token));
        }
    }

    @Nested
    @DisplayName("verifyCallback")
    class VerifyCallbackTests {

        @Test
        @DisplayName("returns the task id for a token issued for the workspace")
        void accepted() {
            String header = "Bearer " + service.generateCallbackToken("t-001", "ws-001");

            assertEquals("t-001", service.verifyCallback(header, "ws-001"));
        }

        @Test
        @DisplayName("rejects a token issued for another workspace")
        void otherWorkspace() {
            String header = "Bearer " + service.generateCallbackToken("t-001", "ws-001");

            InvalidCallbackTokenException thrown = assertThrows(InvalidCallbackTokenException.class,
                    () -> service.verifyCallback(header, "ws-002"));
            assertTrue(thrown.getMessage().contains("ws-002"));
        }

        @Test
        @DisplayName("rejects a node token used as a callback token")
        void wrongAudience() {
            String header = "Bearer " + service.generateNodeToken("n-001", "alice");

            assertThrows(InvalidCallbackTokenException.class, () -> service.verifyCallback(header, "ws-001"));
        }

        @Test
        @DisplayName("rejects missing and malformed headers")
        void malformed() {
            assertThrows(InvalidCallbackTokenException.class, () -> service.verifyCallback(null, "ws-001"));
            assertThrows(InvalidCallbackTokenException.class, () -> service.verifyCallback("Basic abc", "ws-001"));
            assertThrows(InvalidCallbackTokenException.class,
                    () -> service.verifyCallback("Bearer not.a.valid.token", "ws-001"));
        }
    }

    @Nested
    @DisplayName("verifyNode")
    class VerifyNodeTests {

        @Test
        @DisplayName("accepts a token issued for the node")
        void accepted() {
            String header = "Bearer " + service.generateNodeToken("n-001", "alice");

            assertDoesNotThrow(() -> service.verifyNode(header, "n-001"));
        }

        @Test
        @DisplayName("rejects a token for another node or a callback token")
        void rejected() {
            String nodeHeader = "Bearer " + service.generateNodeToken("n-001", "alice");
            String callbackHeader = "Bearer " + service.generateCallbackToken("n-002", "ws-001");

            assertThrows(InvalidCallbackTokenException.class, () -> service.verifyNode(nodeHeader, "n-002"));
            assertThrows(InvalidCallbackTokenException.class, () -> service.verifyNode(callbackHeader, "n-002"));
        }
    }
}
