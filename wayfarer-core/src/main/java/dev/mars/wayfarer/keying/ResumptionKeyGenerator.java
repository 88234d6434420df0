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


package dev.mars.wayfarer.keying;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives stable workflow ids from a free-form context string such as a resolved place
 * name. The context is normalised (trimmed, internal whitespace collapsed, lower-cased),
 * hashed with SHA-256 and the hex digest truncated to a fixed length. The resulting id has
 * the form {@code <domain>:<token>}.
 * <p>
 * Equal normalised contexts always map to the same id. Contexts that normalise differently
 * are treated as different places.
 */
public class ResumptionKeyGenerator {
    private static final String ALGORITHM = "SHA-256";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_TOKEN_LENGTH = 64;

    private final String domain;
    private final int tokenLength;

    public ResumptionKeyGenerator() {
        this("location", 16);
    }

    public ResumptionKeyGenerator(String domain, int tokenLength) {
        if (domain == null || domain.trim().isEmpty()) {
            throw new IllegalArgumentException("Key domain cannot be null or empty");
        }
        if (tokenLength < 1 || tokenLength > MAX_TOKEN_LENGTH) {
            throw new IllegalArgumentException("Token length must be between 1 and " + MAX_TOKEN_LENGTH +
                    ": " + tokenLength);
        }
        this.domain = domain.trim();
        this.tokenLength = tokenLength;
    }

    /**
     * @throws IllegalArgumentException if the context is blank after normalisation
     */
    public String generateWorkflowId(String context) {
        return domain + ":" + generateToken(context);
    }

    public String generateToken(String context) {
        String normalised = normalise(context);
        if (normalised.isEmpty()) {
            throw new IllegalArgumentException("Resumption context cannot be null or empty");
        }
        return sha256Hex(normalised).substring(0, tokenLength);
    }

    public static String normalise(String context) {
        if (context == null) {
            return "";
        }
        return WHITESPACE.matcher(context.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public String getDomain() {
        return domain;
    }

    public int getTokenLength() {
        return tokenLength;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return bytesToHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported digest algorithm: " + ALGORITHM, e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResumptionKeyGenerator that = (ResumptionKeyGenerator) o;
        return tokenLength == that.tokenLength && Objects.equals(domain, that.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, tokenLength);
    }

    @Override
    public String toString() {
        return "ResumptionKeyGenerator{domain='" + domain + "', tokenLength=" + tokenLength + '}';
    }
}
