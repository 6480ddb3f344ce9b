/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.shardwarden.security;

import dev.mars.shardwarden.core.exceptions.KeyGenerationException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * RSA key generation, PEM encoding and SHA-256 signatures for the shard
 * handshake. Public keys are SPKI ("PUBLIC KEY"), private keys PKCS#8
 * ("PRIVATE KEY").
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class KeyPairs {

    public static final String KEY_ALGORITHM = "RSA";
    public static final String SIGN_ALGORITHM = "SHA256withRSA";
    public static final int DEFAULT_KEY_SIZE = 4096;

    private static final String PUBLIC_LABEL = "PUBLIC KEY";
    private static final String PRIVATE_LABEL = "PRIVATE KEY";
    private static final int PEM_LINE_LENGTH = 64;

    private KeyPairs() {
    }

    /**
     * Generates a fresh RSA key pair. With 4096-bit keys this takes long
     * enough that callers on an event loop must move it to a worker thread.
     *
     * @param keySize modulus length in bits
     * @return the new key pair
     * @throws KeyGenerationException if the provider rejects the request
     */
    public static KeyPair generate(int keySize) throws KeyGenerationException {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(keySize);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyGenerationException("Failed to generate " + keySize + "-bit RSA key pair", e);
        }
    }

    public static String toPem(PublicKey key) {
        return pem(PUBLIC_LABEL, key.getEncoded());
    }

    public static String toPem(PrivateKey key) {
        return pem(PRIVATE_LABEL, key.getEncoded());
    }

    public static PublicKey parsePublicKey(String pem) throws GeneralSecurityException {
        byte[] der = decodePem(pem, PUBLIC_LABEL);
        return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
    }

    public static PrivateKey parsePrivateKey(String pem) throws GeneralSecurityException {
        byte[] der = decodePem(pem, PRIVATE_LABEL);
        return KeyFactory.getInstance(KEY_ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(der));
    }

    /**
     * Signs UTF-8 text.
     *
     * @return the base64 signature
     */
    public static String sign(PrivateKey key, String data) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(SIGN_ALGORITHM);
        signature.initSign(key);
        signature.update(data.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(signature.sign());
    }

    /**
     * Verifies a base64 signature over UTF-8 text. Undecodable or malformed
     * signatures verify as false rather than throwing.
     */
    public static boolean verify(PublicKey key, String data, String signatureBase64) {
        try {
            byte[] raw = Base64.getDecoder().decode(signatureBase64);
            Signature signature = Signature.getInstance(SIGN_ALGORITHM);
            signature.initVerify(key);
            signature.update(data.getBytes(StandardCharsets.UTF_8));
            return signature.verify(raw);
        } catch (IllegalArgumentException | SignatureException | InvalidKeyException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(SIGN_ALGORITHM + " is not available", e);
        }
    }

    private static String pem(String label, byte[] der) {
        String body = Base64.getMimeEncoder(PEM_LINE_LENGTH, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(der);
        return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
    }

    private static byte[] decodePem(String pem, String label) throws GeneralSecurityException {
        if (pem == null) {
            throw new GeneralSecurityException("No " + label + " provided");
        }
        String body = pem
                .replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Invalid " + label + " PEM", e);
        }
    }
}
