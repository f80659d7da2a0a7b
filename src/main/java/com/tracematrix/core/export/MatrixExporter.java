package com.tracematrix.core.export;

import com.tracematrix.core.model.Matrix;

/**
 * Renders a finished matrix into one audit artifact. Implementations are stateless and
 * never modify the matrix.
 */
public interface MatrixExporter {

    /** Short format name, e.g. {@code csv}. */
    String format();

    /** File name written inside the export directory. */
    String fileName();

    String render(Matrix matrix);
}
