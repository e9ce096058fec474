/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.domain.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * One-way hashing and generation of agent client secrets.
 *
 * <p>
 * Hashes are SHA-256 hex digests. Comparison runs in constant time over the
 * full digest, so the position of a mismatch is not observable.
 */
@Component
public class SecretHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final int SECRET_LENGTH = 48;
    private static final String SECRET_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Digest of a secret no client can hold, used when the client id is
     * unknown so that both failure paths hash and compare the same amount.
     */
    static final String UNMATCHABLE_HASH = "0".repeat(64);

    public String hash(String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    public boolean matches(String secret, String storedHash) {
        String candidate = hash(secret != null ? secret : "");
        String expected = storedHash != null ? storedHash : UNMATCHABLE_HASH;
        return MessageDigest.isEqual(candidate.getBytes(StandardCharsets.US_ASCII),
                expected.getBytes(StandardCharsets.US_ASCII));
    }

    public String generateSecret() {
        StringBuilder sb = new StringBuilder(SECRET_LENGTH);
        for (int i = 0; i < SECRET_LENGTH; i++) {
            sb.append(SECRET_ALPHABET.charAt(SECURE_RANDOM.nextInt(SECRET_ALPHABET.length())));
        }
        return sb.toString();
    }
}
