package com.tracematrix.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracematrix.core.model.AuditTrail;
import com.tracematrix.core.model.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;

/**
 * Signs a finished matrix with a SHA-256 digest of its canonical form.
 * <p>
 * The canonical form is compact JSON with every object's keys sorted, computed over the
 * matrix without {@code auditTrail} and without {@code metadata.generatedAt}. The signature
 * therefore depends only on scanned content: generating twice from unchanged inputs gives
 * the same signature, and any edit to the body changes it.
 */
@Service
public class AuditSigner {

    private static final Logger log = LoggerFactory.getLogger(AuditSigner.class);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<Map<String, Object>> BODY = new TypeReference<>() {};

    private final Clock clock;

    public AuditSigner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns a copy of {@code matrix} carrying its audit trail. Call only after every
     * other field is final.
     */
    public Matrix sign(Matrix matrix) {
        String signature = signatureOf(matrix);
        log.debug("Matrix signature {}", signature);
        return matrix.withAuditTrail(new AuditTrail(signature, Instant.now(clock).toString()));
    }

    /**
     * @return {@code true} when the matrix has an audit trail matching its current content
     */
    public boolean verify(Matrix matrix) {
        if (matrix.auditTrail() == null || matrix.auditTrail().signature() == null) {
            return false;
        }
        byte[] expected = signatureOf(matrix).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = matrix.auditTrail().signature().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    public String signatureOf(Matrix matrix) {
        return sha256(canonicalForm(matrix));
    }

    String canonicalForm(Matrix matrix) {
        Map<String, Object> body = CANONICAL.convertValue(matrix, BODY);
        body.remove("auditTrail");
        if (body.get("metadata") instanceof Map<?, ?> metadata) {
            metadata.remove("generatedAt");
        }
        try {
            return CANONICAL.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Matrix could not be serialized for signing", e);
        }
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
