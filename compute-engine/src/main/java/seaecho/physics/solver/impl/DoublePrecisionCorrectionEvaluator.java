package seaecho.physics.solver.impl;

import seaecho.physics.solver.CorrectionEvaluator;

/**
 * Corrección térmica en doble precisión IEEE 754.
 * <p>
 * Para X mayor que ~710 sinh y cosh desbordan a infinito y el resultado es NaN.
 */
public class DoublePrecisionCorrectionEvaluator implements CorrectionEvaluator {

    @Override
    public ThermalCorrection evaluate(double x, double gamma) {
        double sinh = Math.sinh(x);
        double sin = Math.sin(x);
        double cosh = Math.cosh(x);
        double cos = Math.cos(x);

        double t1 = x * (sinh + sin) - 2.0 * (cosh - cos);
        double t2 = x * x * (cosh - cos) + 3.0 * (gamma - 1.0) * x * (sinh - sin);
        double dampingRatio = 3.0 * (gamma - 1.0) * t1 / t2;

        double stiffness = 1.0 + (3.0 * gamma - 3.0) / x * (sinh - sin) / (cosh - cos);
        double polytropicFactor = 1.0 / ((1.0 + dampingRatio * dampingRatio) * stiffness);

        return new ThermalCorrection(polytropicFactor, dampingRatio);
    }
}
