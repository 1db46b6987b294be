package com.cronix.scheduler.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.cronix.scheduler.exception.UnauthorizedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * HS256 JSON Web Tokens carrying {@code user_id}, {@code email} and {@code exp},
 * the format the OAuth handoff issues after login.
 */
public class SessionTokens {
    public static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SessionTokens(String secret, ObjectMapper mapper, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("token secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.mapper = mapper;
        this.clock = clock;
    }

    public String issue(String userId, String email, Duration ttl) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        long now = clock.instant().getEpochSecond();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("user_id", userId);
        claims.put("email", email);
        claims.put("iat", now);
        claims.put("exp", now + ttl.toSeconds());
        String signingInput = encode(header) + "." + encode(claims);
        return signingInput + "." + ENCODER.encodeToString(sign(signingInput));
    }

    /**
     * @throws UnauthorizedException if the token is malformed, badly signed or expired
     */
    public Session verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("No authentication token found");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw new UnauthorizedException("invalid token");
        }
        JsonNode header = decode(parts[0]);
        if (!"HS256".equals(header.path("alg").asText())) {
            throw new UnauthorizedException("invalid token");
        }
        byte[] expected = sign(parts[0] + "." + parts[1]);
        byte[] actual;
        try {
            actual = DECODER.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("invalid token");
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new UnauthorizedException("invalid token");
        }

        JsonNode claims = decode(parts[1]);
        JsonNode exp = claims.get("exp");
        if (exp == null || !exp.canConvertToLong() || exp.asLong() <= clock.instant().getEpochSecond()) {
            throw new UnauthorizedException("token expired");
        }
        String userId = claims.path("user_id").asText("");
        try {
            UUID.fromString(userId);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("invalid token");
        }
        return new Session(userId, claims.path("email").asText(null));
    }

    private byte[] sign(String input) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC not available", e);
        }
    }

    private String encode(Map<String, Object> json) {
        try {
            return ENCODER.encodeToString(mapper.writeValueAsBytes(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private JsonNode decode(String part) {
        try {
            JsonNode node = mapper.readTree(DECODER.decode(part));
            if (node == null || !node.isObject()) {
                throw new UnauthorizedException("invalid token");
            }
            return node;
        } catch (IllegalArgumentException | IOException e) {
            throw new UnauthorizedException("invalid token");
        }
    }
}
