package com.tracematrix.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tracematrix.core.model.Matrix;

/**
 * The single JSON mapping for {@link Matrix}, shared by the store and the JSON exporter so
 * that a persisted matrix and an exported one are byte-identical.
 */
public final class MatrixJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MatrixJson() {}

    public static String write(Matrix matrix) throws JsonProcessingException {
        return MAPPER.writeValueAsString(matrix);
    }

    public static Matrix read(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, Matrix.class);
    }
}
