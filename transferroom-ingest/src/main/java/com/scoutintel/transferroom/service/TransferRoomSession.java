package com.scoutintel.transferroom.service;

import com.scoutintel.transferroom.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

/**
 * Bearer-token session against the TransferRoom API.
 *
 * The token is acquired lazily on the first call to {@link #headers()} and then
 * reused for the lifetime of the session. It is held in memory only; there is no
 * expiry tracking, so a session is meant to live for one process run.
 */
@Slf4j
public class TransferRoomSession {

    /** Performs the actual login call; implemented by the API client. */
    @FunctionalInterface
    public interface Authenticator {
        String login(String email, String password);
    }

    private final String email;
    private final String password;
    private final Authenticator authenticator;

    private String token;

    public TransferRoomSession(String email, String password, Authenticator authenticator) {
        this.email = email;
        this.password = password;
        this.authenticator = authenticator;
    }

    /**
     * Log in and cache the bearer token.
     *
     * @throws AuthenticationException if credentials are missing, the login is rejected,
     *                                 or the response has no token
     */
    public synchronized String authenticate() {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            throw new AuthenticationException("TransferRoom credentials are not configured");
        }
        log.info("Authenticating with TransferRoom API as {}", email);
        String acquired = authenticator.login(email, password);
        if (acquired == null || acquired.isBlank()) {
            throw new AuthenticationException("Login response did not contain a token");
        }
        this.token = acquired;
        log.info("Authentication successful");
        return acquired;
    }

    public synchronized HttpHeaders headers() {
        if (token == null) {
            authenticate();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return headers;
    }

    public synchronized boolean isAuthenticated() {
        return token != null;
    }
}
