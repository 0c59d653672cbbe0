package com.example.bulk_campaign.security;

/**
 * セッション確認の結果。未認証なら userId は null。
 */
public record AuthSession(boolean authenticated, String userId) {

    public static AuthSession anonymous() {
        return new AuthSession(false, null);
    }

    public static AuthSession of(String userId) {
        return new AuthSession(true, userId);
    }
}
