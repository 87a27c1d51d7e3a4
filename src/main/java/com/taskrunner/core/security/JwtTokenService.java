package com.taskrunner.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies the signed credentials exchanged with node agents.
 * <p>
 * A callback token is scoped to one task and one workspace and authenticates the
 * agent's readiness and status callbacks. A node token is scoped to one node and
 * authenticates both directions of node agent traffic (management calls and heartbeats).
 */
@Service
public class JwtTokenService {

    static final String CALLBACK_AUDIENCE = "workspace-callback";
    static final String NODE_AUDIENCE = "node-agent";

    private final SecretKey signingKey;
    private final int expirationSeconds;

    public JwtTokenService(
            @Value("${taskrunner.security.jwt.secret}") String secret,
            @Value("${taskrunner.security.jwt.expiration-seconds:86400}") int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateCallbackToken(String taskId, String workspaceId) {
        Date now = new Date();
        return Jwts.builder()
                .subject(taskId)
                .audience().add(CALLBACK_AUDIENCE).and()
                .claim("workspaceId", workspaceId)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expirationSeconds * 1000L))
                .signWith(signingKey)
                .compact();
    }

    public String generateNodeToken(String nodeId, String userId) {
        Date now = new Date();
        return Jwts.builder()
                .subject(nodeId)
                .audience().add(NODE_AUDIENCE).and()
                .claim("userId", userId)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expirationSeconds * 1000L))
                .signWith(signingKey)
                .compact();
    }

    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Verifies a callback token from an {@code Authorization} header value and checks that
     * it was issued for {@code workspaceId}.
     *
     * @return the id of the task the token was issued for
     */
    public String verifyCallback(String authorizationHeader, String workspaceId) {
        Claims claims = parseBearer(authorizationHeader);
        if (claims.getAudience() == null || !claims.getAudience().contains(CALLBACK_AUDIENCE)) {
            throw new InvalidCallbackTokenException("Token is not a workspace callback token");
        }
        if (!workspaceId.equals(claims.get("workspaceId", String.class))) {
            throw new InvalidCallbackTokenException("Token was not issued for workspace " + workspaceId);
        }
        return claims.getSubject();
    }

    /** Verifies a node token and checks that it was issued for {@code nodeId}. */
    public void verifyNode(String authorizationHeader, String nodeId) {
        Claims claims = parseBearer(authorizationHeader);
        if (claims.getAudience() == null || !claims.getAudience().contains(NODE_AUDIENCE)) {
            throw new InvalidCallbackTokenException("Token is not a node token");
        }
        if (!nodeId.equals(claims.getSubject())) {
            throw new InvalidCallbackTokenException("Token was not issued for node " + nodeId);
        }
    }

    private Claims parseBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith("Bearer ")) {
            throw new InvalidCallbackTokenException("Missing bearer token");
        }
        try {
            return validateToken(authorizationHeader.substring("Bearer ".length()).trim());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidCallbackTokenException("Invalid token: " + e.getMessage(), e);
        }
    }
}
