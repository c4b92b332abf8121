package com.example.realtime.service;

import com.example.realtime.service.exception.AuthException;
import com.example.realtime.service.exception.ConnectionException;

/**
 * Resolves a bearer credential to the profile that owns it. Token issuance lives elsewhere.
 */
public interface CredentialVerifier {

    /**
     * @return the verified profile id
     * @throws AuthException if the credential is invalid or resolves to no profile
     * @throws ConnectionException if the verifying service cannot be reached
     */
    String resolveProfileId(String bearerToken);
}
