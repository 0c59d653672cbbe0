package com.example.bulk_campaign.security;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    @Value("${wordpress.login-url:https://ecommercean.com/log-in/}")
    private String loginUrl;

    @Value("${app.url:http://localhost:10000}")
    private String appUrl;

    /**
     * 現在のセッション（JwtAuthFilter で検証済みのトークン）
     *
     * GET /auth/session
     */
    @GetMapping("/session")
    public ResponseEntity<?> session() {
        AuthSession session = currentSession();
        Map<String, Object> body = new HashMap<>();
        body.put("authenticated", session.authenticated());
        body.put("userId", session.userId());
        return ResponseEntity.ok(body);
    }

    /**
     * WordPress ログインページ（ログイン後このアプリに戻す）
     *
     * GET /auth/login-url
     */
    @GetMapping("/login-url")
    public ResponseEntity<?> loginUrl() {
        return ResponseEntity.ok(Map.of("loginUrl", buildLoginUrl()));
    }

    String buildLoginUrl() {
        return loginUrl + "?redirect_to=" + URLEncoder.encode(appUrl, StandardCharsets.UTF_8);
    }

    private AuthSession currentSession() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || "anonymousUser".equals(auth.getPrincipal())) {
            return AuthSession.anonymous();
        }
        return AuthSession.of(auth.getName());
    }
}
