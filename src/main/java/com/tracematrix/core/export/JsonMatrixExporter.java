package com.tracematrix.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tracematrix.core.model.Matrix;
import com.tracematrix.core.persistence.MatrixJson;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Verbatim JSON serialization of the matrix, readable back into an equal {@link Matrix}.
 */
@Component
@Order(3)
public class JsonMatrixExporter implements MatrixExporter {

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String fileName() {
        return "traceability-matrix.json";
    }

    @Override
    public String render(Matrix matrix) {
        try {
            return MatrixJson.write(matrix);
        } catch (JsonProcessingException e) {
            throw new ExportException("Could not serialize matrix to JSON", e);
        }
    }
}
