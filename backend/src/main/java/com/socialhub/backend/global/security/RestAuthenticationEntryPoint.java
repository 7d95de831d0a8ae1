package com.socialhub.backend.global.security;

import java.io.IOException;

import com.socialhub.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Renders 401 as a problem body. A rejected bearer token and a request without one get
 * different codes so clients know whether refreshing can help.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    static final String INVALID_ACCESS_TOKEN = "auth.invalid_access_token";
    static final String AUTHENTICATION_REQUIRED = "auth.authentication_required";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body;
        if (authException instanceof BadCredentialsException) {
            log.debug("Rejected access token on {}", request.getRequestURI());
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, INVALID_ACCESS_TOKEN,
                    "Invalid or expired access token", request.getRequestURI());
        } else {
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, AUTHENTICATION_REQUIRED,
                    "Authentication required", request.getRequestURI());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
