/*
 * Copyright @ 2018 - present 8x8, Inc.
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
package org.jitsi.sfu.signaling;

import org.jetbrains.annotations.*;

import javax.crypto.*;
import javax.crypto.spec.*;
import java.nio.charset.*;
import java.security.*;
import java.util.*;

/**
 * Encrypts and decrypts signaling payloads (e.g. session descriptions) with
 * AES-256 in CBC mode. The key and IV are keying material supplied by the
 * caller; this class neither generates nor rotates them. Instances are
 * thread-safe.
 */
public class SignalingCipher
{
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";

    public static final int KEY_LENGTH = 32;

    public static final int IV_LENGTH = 16;

    private final SecretKeySpec key;

    private final IvParameterSpec iv;

    /**
     * @param key a 256-bit AES key.
     * @param iv a 128-bit initialization vector.
     * @throws IllegalArgumentException if the key or IV have the wrong length.
     */
    public SignalingCipher(@NotNull byte[] key, @NotNull byte[] iv)
    {
        if (key == null || key.length != KEY_LENGTH)
        {
            throw new IllegalArgumentException("The key must be " + KEY_LENGTH + " bytes long");
        }
        if (iv == null || iv.length != IV_LENGTH)
        {
            throw new IllegalArgumentException("The IV must be " + IV_LENGTH + " bytes long");
        }
        this.key = new SecretKeySpec(key, "AES");
        this.iv = new IvParameterSpec(iv.clone());
    }

    /**
     * @param payload the payload to encrypt.
     * @return the ciphertext as lowercase hex.
     * @throws IllegalArgumentException if <tt>payload</tt> is null.
     */
    public @NotNull String encrypt(String payload)
    {
        if (payload == null)
        {
            throw new IllegalArgumentException("Invalid input type: payload must be a string");
        }

        byte[] encrypted = doFinal(Cipher.ENCRYPT_MODE, payload.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(encrypted);
    }

    /**
     * @param encryptedPayload ciphertext as produced by {@link #encrypt}.
     * @return the decrypted payload.
     * @throws IllegalArgumentException if <tt>encryptedPayload</tt> is null,
     * not hex, or was not encrypted with this key and IV.
     */
    public @NotNull String decrypt(String encryptedPayload)
    {
        if (encryptedPayload == null)
        {
            throw new IllegalArgumentException("Invalid input type: payload must be a string");
        }

        byte[] encrypted;
        try
        {
            encrypted = HexFormat.of().parseHex(encryptedPayload);
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Encrypted payload is not valid hex", e);
        }
        return new String(doFinal(Cipher.DECRYPT_MODE, encrypted), StandardCharsets.UTF_8);
    }

    private byte[] doFinal(int mode, byte[] input)
    {
        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(mode, key, iv);
            return cipher.doFinal(input);
        }
        catch (BadPaddingException | IllegalBlockSizeException e)
        {
            throw new IllegalArgumentException("Failed to decrypt payload", e);
        }
        catch (GeneralSecurityException e)
        {
            // AES/CBC/PKCS5Padding is mandatory for every JRE.
            throw new IllegalStateException("Cipher " + TRANSFORMATION + " unavailable", e);
        }
    }
}
