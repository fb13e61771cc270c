package com.trading.fincalc.error;

import lombok.Getter;

/**
 * The matrix has no inverse: the best available pivot fell below the
 * configured threshold. Not retryable.
 */
@Getter
public class SingularMatrixException extends KernelException {
    private final int column;

    public SingularMatrixException(int column) {
        super("Singular matrix cannot be inverted (no usable pivot in column " + column + ")");
        this.column = column;
    }
}
