package com.trading.fincalc.linalg;

import com.trading.fincalc.error.DimensionMismatchException;
import com.trading.fincalc.error.DivisionByZeroException;
import com.trading.fincalc.error.SingularMatrixException;
import com.trading.fincalc.math.Decimals;
import org.junit.Test;

import java.math.BigDecimal;

import static com.trading.fincalc.math.Decimals.matrix;
import static com.trading.fincalc.math.Decimals.vector;
import static org.junit.Assert.*;

public class LinearAlgebraTest {

    private static final BigDecimal CELL_TOLERANCE = new BigDecimal("0.0000001");

    private final LinearAlgebra la = new LinearAlgebra(Decimals.DEFAULT_CONTEXT, new BigDecimal("0.0000000001"));

    private static void assertIdentity(BigDecimal[][] m) {
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m.length; j++) {
                BigDecimal expected = i == j ? BigDecimal.ONE : BigDecimal.ZERO;
                assertTrue("cell [" + i + "," + j + "] = " + m[i][j],
                        Decimals.closeTo(expected, m[i][j], CELL_TOLERANCE));
            }
        }
    }

    @Test
    public void testInverseTimesMatrixIsIdentity() {
        BigDecimal[][] a = matrix(
                new String[] { "4", "7", "2" },
                new String[] { "3", "6", "1" },
                new String[] { "2", "5", "3" });
        BigDecimal[][] inv = la.inverse(a);
        assertIdentity(la.multiply(a, inv));
        assertIdentity(la.multiply(inv, a));
    }

    @Test
    public void testInverseNeedsPivoting() {
        // Zero in the leading position
        BigDecimal[][] a = matrix(
                new String[] { "0", "1" },
                new String[] { "1", "0" });
        BigDecimal[][] inv = la.inverse(a);
        assertIdentity(la.multiply(a, inv));
    }

    @Test
    public void testInverseOfCovariance() {
        BigDecimal[][] sigma = matrix(
                new String[] { "0.04", "0.006", "0.002" },
                new String[] { "0.006", "0.09", "0.01" },
                new String[] { "0.002", "0.01", "0.0625" });
        assertIdentity(la.multiply(sigma, la.inverse(sigma)));
    }

    @Test
    public void testSingularMatrix() {
        BigDecimal[][] a = matrix(
                new String[] { "1", "2" },
                new String[] { "2", "4" });
        try {
            la.inverse(a);
            fail("Should throw SingularMatrixException");
        } catch (SingularMatrixException e) {
            assertEquals(1, e.getColumn());
            assertTrue(e.getMessage().contains("Singular"));
        }
    }

    @Test
    public void testInverseDiagonal() {
        BigDecimal[][] d = matrix(
                new String[] { "2", "0" },
                new String[] { "0", "0.5" });
        BigDecimal[][] inv = la.inverseDiagonal(d);
        assertEquals(0, inv[0][0].compareTo(new BigDecimal("0.5")));
        assertEquals(0, inv[1][1].compareTo(new BigDecimal("2")));
        assertEquals(0, inv[0][1].signum());

        d[1][1] = BigDecimal.ZERO;
        try {
            la.inverseDiagonal(d);
            fail("Should throw DivisionByZeroException");
        } catch (DivisionByZeroException e) {
            assertTrue(e.getMessage().contains("[1,1]"));
        }
    }

    @Test
    public void testProductsAndTranspose() {
        BigDecimal[][] a = matrix(
                new String[] { "1", "2", "3" },
                new String[] { "4", "5", "6" });
        BigDecimal[][] t = la.transpose(a);
        assertEquals(3, t.length);
        assertEquals(2, t[0].length);
        assertEquals(0, t[2][1].compareTo(new BigDecimal("6")));

        BigDecimal[][] aat = la.multiplyTransposeRight(a, a);
        BigDecimal[][] expected = la.multiply(a, t);
        for (int i = 0; i < 2; i++)
            for (int j = 0; j < 2; j++)
                assertEquals(0, expected[i][j].compareTo(aat[i][j]));
        assertEquals(0, aat[0][1].compareTo(new BigDecimal("32")));

        BigDecimal[] v = la.multiply(a, vector("1", "0", "-1"));
        assertEquals(0, v[0].compareTo(new BigDecimal("-2")));
        assertEquals(0, v[1].compareTo(new BigDecimal("-2")));
    }

    @Test
    public void testElementwise() {
        BigDecimal[] a = vector("1.5", "2");
        BigDecimal[] b = vector("0.5", "-1");
        assertEquals(0, la.add(a, b)[1].compareTo(BigDecimal.ONE));
        assertEquals(0, la.subtract(a, b)[0].compareTo(BigDecimal.ONE));
        assertEquals(0, la.dot(a, b).compareTo(new BigDecimal("-1.25")));

        BigDecimal[][] m = la.add(LinearAlgebra.identity(2), la.scale(LinearAlgebra.identity(2), Decimals.TWO));
        assertEquals(0, m[1][1].compareTo(new BigDecimal("3")));
        assertEquals(0, m[0][1].signum());
    }

    @Test
    public void testQuadraticForm() {
        BigDecimal[][] sigma = matrix(
                new String[] { "0.04", "0.01" },
                new String[] { "0.01", "0.09" });
        BigDecimal variance = la.quadraticForm(vector("0.5", "0.5"), sigma);
        assertEquals(0, variance.compareTo(new BigDecimal("0.0375")));
    }

    @Test
    public void testIsSymmetric() {
        BigDecimal[][] sym = matrix(
                new String[] { "1", "0.3" },
                new String[] { "0.3", "1" });
        BigDecimal[][] asym = matrix(
                new String[] { "1", "0.3" },
                new String[] { "0.31", "1" });
        BigDecimal tol = new BigDecimal("0.0000001");
        assertTrue(LinearAlgebra.isSymmetric(sym, tol));
        assertFalse(LinearAlgebra.isSymmetric(asym, tol));
        assertTrue(LinearAlgebra.isSymmetric(asym, new BigDecimal("0.1")));
        assertFalse(LinearAlgebra.isSymmetric(matrix(new String[] { "1", "2" }), tol));
    }

    @Test
    public void testDimensionMismatch() {
        try {
            la.dot(vector("1", "2"), vector("1"));
            fail("Should throw DimensionMismatchException for dot");
        } catch (DimensionMismatchException e) {
            assertTrue(e.getMessage().contains("dot"));
        }

        BigDecimal[][] twoByThree = matrix(
                new String[] { "1", "2", "3" },
                new String[] { "4", "5", "6" });
        try {
            la.multiply(twoByThree, twoByThree);
            fail("Should throw DimensionMismatchException for multiply");
        } catch (DimensionMismatchException e) {
            assertTrue(e.getMessage().contains("2x3"));
        }

        try {
            la.inverse(twoByThree);
            fail("Should throw DimensionMismatchException for a non-square inverse");
        } catch (DimensionMismatchException e) {
            assertTrue(e.getMessage().contains("square"));
        }

        BigDecimal[][] ragged = new BigDecimal[][] { vector("1", "2"), vector("3") };
        try {
            la.transpose(ragged);
            fail("Should throw DimensionMismatchException for a ragged matrix");
        } catch (DimensionMismatchException e) {
            assertTrue(e.getMessage().contains("ragged"));
        }
    }

    @Test
    public void testInputsAreNotModified() {
        BigDecimal[][] a = matrix(
                new String[] { "0", "1" },
                new String[] { "1", "0" });
        la.inverse(a);
        assertEquals(0, a[0][0].signum());
        assertEquals(0, a[0][1].compareTo(BigDecimal.ONE));
    }
}
