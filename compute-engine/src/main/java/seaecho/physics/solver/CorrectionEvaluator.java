package seaecho.physics.solver;

/**
 * Evalúa la corrección térmica de Prosperetti/Devin sobre la frecuencia de resonancia
 * de una burbuja.
 * <p>
 * El parámetro adimensional {@code X = a·sqrt(2ωρ_g·Cp/K)} aparece dentro de sinh, cosh, sin y cos;
 * para burbujas grandes o frecuencias altas X supera con holgura el rango de la doble precisión,
 * por eso la aritmética concreta es intercambiable.
 */
public interface CorrectionEvaluator {

    /**
     * @param x     Parámetro térmico adimensional X.
     * @param gamma Cociente de calores específicos del gas.
     * @return La corrección. Puede contener NaN si la aritmética no es capaz de representarla.
     */
    ThermalCorrection evaluate(double x, double gamma);

    /**
     * Resultado de la corrección térmica.
     *
     * @param polytropicFactor Factor b que escala la rigidez del gas.
     * @param dampingRatio     Cociente d/b que alimenta el amortiguamiento térmico.
     */
    record ThermalCorrection(double polytropicFactor, double dampingRatio) {

        public static final ThermalCorrection UNDEFINED = new ThermalCorrection(Double.NaN, Double.NaN);

        public boolean isFinite() {
            return Double.isFinite(polytropicFactor) && Double.isFinite(dampingRatio);
        }
    }
}
