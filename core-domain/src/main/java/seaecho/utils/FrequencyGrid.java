package seaecho.utils;

/**
 * Utilidades para construir ejes de frecuencia (o de diámetro) de un barrido.
 */
public final class FrequencyGrid {

    private FrequencyGrid() {
    }

    /**
     * Genera {@code count} valores equiespaciados entre {@code start} y {@code end}, ambos incluidos.
     */
    public static double[] linSpace(double start, double end, int count) {
        checkCount(count);
        double[] values = new double[count];
        if (count == 1) {
            values[0] = start;
            return values;
        }
        double step = (end - start) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        // El último punto exacto, sin error de acumulación
        values[count - 1] = end;
        return values;
    }

    /**
     * Genera {@code count} valores espaciados logarítmicamente entre {@code start} y {@code end}.
     *
     * @throws IllegalArgumentException si algún extremo no es positivo.
     */
    public static double[] logSpace(double start, double end, int count) {
        checkCount(count);
        if (!(start > 0.0) || !(end > 0.0)) {
            throw new IllegalArgumentException("Los extremos de un eje logarítmico deben ser positivos: [" + start + ", " + end + "]");
        }
        double[] exponents = linSpace(Math.log10(start), Math.log10(end), count);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = Math.pow(10.0, exponents[i]);
        }
        values[0] = start;
        values[count - 1] = end;
        return values;
    }

    private static void checkCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("El número de puntos debe ser >= 1: " + count);
        }
    }
}
