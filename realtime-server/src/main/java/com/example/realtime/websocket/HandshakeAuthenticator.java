package com.example.realtime.websocket;

import com.example.realtime.service.CredentialVerifier;
import com.example.realtime.service.exception.AuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks that the handshake token belongs to the profile the client claims to be.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HandshakeAuthenticator {

    private final CredentialVerifier credentialVerifier;

    /**
     * @return the verified profile id, never the claimed one
     * @throws AuthException on a missing token, missing claim, invalid token or mismatch
     */
    public String authenticate(String token, String claimedProfileId) {
        if (!StringUtils.hasText(token)) {
            throw new AuthException("Authentication token required");
        }
        if (!StringUtils.hasText(claimedProfileId)) {
            throw new AuthException("Profile ID required");
        }
        String verifiedProfileId = credentialVerifier.resolveProfileId(token);
        if (!claimedProfileId.equals(verifiedProfileId)) {
            log.error("Profile id mismatch on handshake: claimed {}, token belongs to {}", claimedProfileId, verifiedProfileId);
            throw new AuthException("Invalid profile ID");
        }
        return verifiedProfileId;
    }
}
