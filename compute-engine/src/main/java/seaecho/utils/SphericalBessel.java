package seaecho.utils;

import org.apache.commons.math3.special.BesselJ;

import java.util.Arrays;

/**
 * Funciones esféricas de Bessel de primera y segunda especie y sus derivadas.
 * <p>
 * {@code j_n} se obtiene de la función de Bessel cilíndrica de orden semientero
 * ({@code j_n(x) = sqrt(π/2x) · J_{n+1/2}(x)}); {@code y_n} por recurrencia ascendente,
 * que es estable para la segunda especie.
 */
public final class SphericalBessel {

    private SphericalBessel() {
    }

    /**
     * Valores {@code j_0(x) ... j_nMax(x)}.
     *
     * @param x Argumento, debe ser > 0.
     */
    public static double[] firstKind(int nMax, double x) {
        checkArgument(x);
        // Todos los órdenes n + 1/2 de una sola pasada
        BesselJ.BesselJResult result = BesselJ.rjBesl(x, 0.5, nMax + 1);
        if (result.getnVals() < 0) {
            throw new IllegalArgumentException("Argumento fuera del dominio de BesselJ: x=" + x + ", nMax=" + nMax);
        }
        double[] cylindrical = result.getVals();
        double[] j = new double[nMax + 1];
        double scale = Math.sqrt(Math.PI / (2.0 * x));
        for (int n = 0; n <= nMax; n++) {
            j[n] = scale * cylindrical[n];
        }
        return j;
    }

    /**
     * Valores {@code y_0(x) ... y_nMax(x)}.
     *
     * @param x Argumento, debe ser > 0.
     */
    public static double[] secondKind(int nMax, double x) {
        checkArgument(x);
        double[] y = new double[Math.max(nMax + 1, 2)];
        y[0] = -Math.cos(x) / x;
        y[1] = -Math.cos(x) / (x * x) - Math.sin(x) / x;
        for (int n = 1; n < nMax; n++) {
            y[n + 1] = (2 * n + 1) / x * y[n] - y[n - 1];
        }
        return Arrays.copyOf(y, nMax + 1);
    }

    /**
     * Derivadas {@code f'_n(x)} a partir de los valores {@code f_0 ... f_nMax}
     * de cualquiera de las dos especies.
     * <p>
     * {@code f'_0 = -f_1} y {@code f'_n = f_{n-1} - (n+1)/x · f_n}. Exige al menos dos órdenes.
     */
    public static double[] derivative(double[] values, double x) {
        if (values.length < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos órdenes para derivar.");
        }
        double[] d = new double[values.length];
        d[0] = -values[1];
        for (int n = 1; n < values.length; n++) {
            d[n] = values[n - 1] - (n + 1) / x * values[n];
        }
        return d;
    }

    /**
     * Número de términos de la serie modal para un argumento dado (criterio de Wiscombe).
     */
    public static int truncationOrder(double x) {
        return Math.max(3, (int) Math.ceil(x + 4.0 * Math.cbrt(x) + 2.0));
    }

    private static void checkArgument(double x) {
        if (!(x > 0.0) || Double.isInfinite(x)) {
            throw new IllegalArgumentException("El argumento de las funciones de Bessel debe ser positivo y finito: " + x);
        }
    }
}
