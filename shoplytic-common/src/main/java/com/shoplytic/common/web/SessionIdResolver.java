package com.shoplytic.common.web;

import jakarta.servlet.http.HttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the anonymous session id from the caller's network identity.
 * <p>
 * The client address is taken from the first {@code X-Forwarded-For} entry,
 * then {@code X-Real-IP}, then the socket address. The session id is
 * {@code session_} followed by the first 16 hex characters of its MD5 digest.
 */
public final class SessionIdResolver {

    public static final String UNKNOWN_CLIENT = "unknown";
    private static final String SESSION_PREFIX = "session_";
    private static final int HASH_LENGTH = 16;

    private SessionIdResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        return fromClientIp(clientIp(request));
    }

    public static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }

        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : UNKNOWN_CLIENT;
    }

    public static String fromClientIp(String clientIp) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(clientIp.getBytes(StandardCharsets.UTF_8));
            return SESSION_PREFIX + HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
