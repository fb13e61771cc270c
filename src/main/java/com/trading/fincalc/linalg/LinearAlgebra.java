package com.trading.fincalc.linalg;

import static com.trading.fincalc.math.Decimals.ONE;
import static com.trading.fincalc.math.Decimals.ZERO;

import java.math.BigDecimal;
import java.math.MathContext;

import com.trading.fincalc.error.DimensionMismatchException;
import com.trading.fincalc.error.DivisionByZeroException;
import com.trading.fincalc.error.SingularMatrixException;

/**
 * Dense vector and matrix operations over {@code BigDecimal}.
 *
 * <p>
 * Sized for portfolio work (tens of assets). Matrices are row-major
 * {@code BigDecimal[rows][cols]} and must be rectangular; every combining
 * operation checks conformability first and throws
 * {@link DimensionMismatchException}. Inputs are never modified.
 *
 * <p>
 * Symmetry of covariance matrices is the caller's responsibility; see
 * {@link #isSymmetric(BigDecimal[][], BigDecimal)}.
 */
public final class LinearAlgebra {
    private final MathContext mc;
    private final BigDecimal pivotThreshold;

    /**
     * @param mc             Rounding context for every operation.
     * @param pivotThreshold Inversion fails when the best pivot magnitude is
     *                       below this.
     */
    public LinearAlgebra(MathContext mc, BigDecimal pivotThreshold) {
        this.mc = mc;
        this.pivotThreshold = pivotThreshold;
    }

    public BigDecimal dot(BigDecimal[] a, BigDecimal[] b) {
        if (a.length != b.length)
            throw new DimensionMismatchException("dot: lengths " + a.length + " and " + b.length);
        BigDecimal sum = ZERO;
        for (int i = 0; i < a.length; i++)
            sum = sum.add(a[i].multiply(b[i], mc), mc);
        return sum;
    }

    /** result_i = sum_j m[i][j] * v[j] */
    public BigDecimal[] multiply(BigDecimal[][] m, BigDecimal[] v) {
        int cols = columns(m, "multiply");
        if (m.length > 0 && cols != v.length)
            throw new DimensionMismatchException("multiply: " + shape(m) + " by vector of length " + v.length);
        BigDecimal[] out = new BigDecimal[m.length];
        for (int i = 0; i < m.length; i++)
            out[i] = dot(m[i], v);
        return out;
    }

    /** C = A * B */
    public BigDecimal[][] multiply(BigDecimal[][] a, BigDecimal[][] b) {
        int inner = columns(a, "multiply");
        int cols = columns(b, "multiply");
        if (inner != b.length)
            throw new DimensionMismatchException("multiply: " + shape(a) + " by " + shape(b));
        BigDecimal[][] c = new BigDecimal[a.length][cols];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < cols; j++) {
                BigDecimal sum = ZERO;
                for (int k = 0; k < inner; k++)
                    sum = sum.add(a[i][k].multiply(b[k][j], mc), mc);
                c[i][j] = sum;
            }
        }
        return c;
    }

    /** C = A * B', without materialising the transpose. */
    public BigDecimal[][] multiplyTransposeRight(BigDecimal[][] a, BigDecimal[][] b) {
        int inner = columns(a, "multiplyTransposeRight");
        int bCols = columns(b, "multiplyTransposeRight");
        if (b.length > 0 && inner != bCols)
            throw new DimensionMismatchException("multiplyTransposeRight: " + shape(a) + " by transpose of "
                    + shape(b));
        BigDecimal[][] c = new BigDecimal[a.length][b.length];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < b.length; j++) {
                BigDecimal sum = ZERO;
                for (int k = 0; k < inner; k++)
                    sum = sum.add(a[i][k].multiply(b[j][k], mc), mc);
                c[i][j] = sum;
            }
        }
        return c;
    }

    public BigDecimal[][] transpose(BigDecimal[][] m) {
        int cols = columns(m, "transpose");
        BigDecimal[][] t = new BigDecimal[cols][m.length];
        for (int i = 0; i < m.length; i++)
            for (int j = 0; j < cols; j++)
                t[j][i] = m[i][j];
        return t;
    }

    public BigDecimal[][] add(BigDecimal[][] a, BigDecimal[][] b) {
        requireSameShape(a, b, "add");
        BigDecimal[][] c = new BigDecimal[a.length][];
        for (int i = 0; i < a.length; i++)
            c[i] = add(a[i], b[i]);
        return c;
    }

    public BigDecimal[] add(BigDecimal[] a, BigDecimal[] b) {
        if (a.length != b.length)
            throw new DimensionMismatchException("add: lengths " + a.length + " and " + b.length);
        BigDecimal[] c = new BigDecimal[a.length];
        for (int i = 0; i < a.length; i++)
            c[i] = a[i].add(b[i], mc);
        return c;
    }

    public BigDecimal[] subtract(BigDecimal[] a, BigDecimal[] b) {
        if (a.length != b.length)
            throw new DimensionMismatchException("subtract: lengths " + a.length + " and " + b.length);
        BigDecimal[] c = new BigDecimal[a.length];
        for (int i = 0; i < a.length; i++)
            c[i] = a[i].subtract(b[i], mc);
        return c;
    }

    public BigDecimal[][] scale(BigDecimal[][] m, BigDecimal s) {
        int cols = columns(m, "scale");
        BigDecimal[][] out = new BigDecimal[m.length][cols];
        for (int i = 0; i < m.length; i++)
            for (int j = 0; j < cols; j++)
                out[i][j] = m[i][j].multiply(s, mc);
        return out;
    }

    public BigDecimal[] scale(BigDecimal[] v, BigDecimal s) {
        BigDecimal[] out = new BigDecimal[v.length];
        for (int i = 0; i < v.length; i++)
            out[i] = v[i].multiply(s, mc);
        return out;
    }

    public static BigDecimal[][] identity(int n) {
        BigDecimal[][] id = new BigDecimal[n][n];
        for (int i = 0; i < n; i++)
            for (int j = 0; j < n; j++)
                id[i][j] = i == j ? ONE : ZERO;
        return id;
    }

    /**
     * Full inverse by Gauss-Jordan elimination with partial pivoting.
     *
     * <ol>
     * <li>Augment with the identity: [A | I].</li>
     * <li>Per column, swap up the row with the largest magnitude.</li>
     * <li>Normalise the pivot row, eliminate the column from every other row.</li>
     * <li>The right half is A^-1.</li>
     * </ol>
     *
     * @throws SingularMatrixException when a pivot magnitude is below the
     *                                 threshold.
     */
    public BigDecimal[][] inverse(BigDecimal[][] m) {
        int n = m.length;
        requireSquare(m, "inverse");
        if (n == 0)
            return new BigDecimal[0][0];

        BigDecimal[][] aug = new BigDecimal[n][2 * n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(m[i], 0, aug[i], 0, n);
            for (int j = 0; j < n; j++)
                aug[i][n + j] = i == j ? ONE : ZERO;
        }

        for (int col = 0; col < n; col++) {
            // 1. Partial pivoting
            int maxRow = col;
            BigDecimal maxVal = aug[col][col].abs();
            for (int row = col + 1; row < n; row++) {
                BigDecimal val = aug[row][col].abs();
                if (val.compareTo(maxVal) > 0) {
                    maxVal = val;
                    maxRow = row;
                }
            }
            if (maxVal.compareTo(pivotThreshold) < 0)
                throw new SingularMatrixException(col);
            if (maxRow != col) {
                BigDecimal[] tmp = aug[col];
                aug[col] = aug[maxRow];
                aug[maxRow] = tmp;
            }

            // 2. Normalise pivot row
            BigDecimal pivot = aug[col][col];
            BigDecimal[] pivotRow = aug[col];
            for (int j = 0; j < 2 * n; j++)
                pivotRow[j] = pivotRow[j].divide(pivot, mc);

            // 3. Eliminate
            for (int row = 0; row < n; row++) {
                if (row == col)
                    continue;
                BigDecimal factor = aug[row][col];
                if (factor.signum() == 0)
                    continue;
                for (int j = 0; j < 2 * n; j++)
                    aug[row][j] = aug[row][j].subtract(factor.multiply(pivotRow[j], mc), mc);
            }
        }

        BigDecimal[][] inv = new BigDecimal[n][n];
        for (int i = 0; i < n; i++)
            System.arraycopy(aug[i], n, inv[i], 0, n);
        return inv;
    }

    /**
     * O(n) inverse of a diagonal matrix. Off-diagonal entries are ignored.
     *
     * @throws DivisionByZeroException on a zero diagonal element.
     */
    public BigDecimal[][] inverseDiagonal(BigDecimal[][] m) {
        int n = m.length;
        requireSquare(m, "inverseDiagonal");
        BigDecimal[][] inv = new BigDecimal[n][n];
        for (int i = 0; i < n; i++) {
            if (m[i][i].signum() == 0)
                throw new DivisionByZeroException("diagonal element [" + i + "," + i + "] is zero");
            for (int j = 0; j < n; j++)
                inv[i][j] = ZERO;
            inv[i][i] = ONE.divide(m[i][i], mc);
        }
        return inv;
    }

    /** w' * S * w, e.g. portfolio variance for weights w and covariance S. */
    public BigDecimal quadraticForm(BigDecimal[] w, BigDecimal[][] s) {
        return dot(w, multiply(s, w));
    }

    /** True when square and |m[i][j] - m[j][i]| &le; tolerance everywhere. */
    public static boolean isSymmetric(BigDecimal[][] m, BigDecimal tolerance) {
        int n = m.length;
        for (BigDecimal[] row : m) {
            if (row.length != n)
                return false;
        }
        for (int i = 0; i < n; i++)
            for (int j = i + 1; j < n; j++)
                if (m[i][j].subtract(m[j][i]).abs().compareTo(tolerance) > 0)
                    return false;
        return true;
    }

    /** Column count of a rectangular matrix; 0 for a matrix without rows. */
    private static int columns(BigDecimal[][] m, String op) {
        if (m.length == 0)
            return 0;
        int cols = m[0].length;
        for (int i = 1; i < m.length; i++) {
            if (m[i].length != cols)
                throw new DimensionMismatchException(op + ": ragged matrix, row " + i + " has " + m[i].length
                        + " columns, expected " + cols);
        }
        return cols;
    }

    private static void requireSquare(BigDecimal[][] m, String op) {
        int cols = columns(m, op);
        if (m.length > 0 && cols != m.length)
            throw new DimensionMismatchException(op + ": matrix must be square, got " + shape(m));
    }

    private static void requireSameShape(BigDecimal[][] a, BigDecimal[][] b, String op) {
        int ac = columns(a, op);
        int bc = columns(b, op);
        if (a.length != b.length || ac != bc)
            throw new DimensionMismatchException(op + ": " + shape(a) + " and " + shape(b));
    }

    private static String shape(BigDecimal[][] m) {
        return m.length + "x" + (m.length == 0 ? 0 : m[0].length);
    }
}
