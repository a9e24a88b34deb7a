package seaecho.physics.solver.impl;

import org.apache.commons.math3.dfp.Dfp;
import org.apache.commons.math3.dfp.DfpField;
import org.apache.commons.math3.dfp.DfpMath;
import seaecho.physics.solver.CorrectionEvaluator;

/**
 * Corrección térmica en aritmética decimal de precisión arbitraria ({@link Dfp}).
 * <p>
 * El rango de exponentes de {@code Dfp} cubre sinh/cosh de argumentos de varios miles,
 * y los cocientes finales vuelven a caber en un double.
 * <p>
 * {@link DfpField} guarda banderas IEEE mutables, así que cada hilo usa su propio campo.
 */
public class ExtendedPrecisionCorrectionEvaluator implements CorrectionEvaluator {

    private final int digits;
    private final ThreadLocal<DfpField> fields;

    public ExtendedPrecisionCorrectionEvaluator(int digits) {
        if (digits < 16) {
            throw new IllegalArgumentException("La precisión extendida debe tener al menos 16 dígitos: " + digits);
        }
        this.digits = digits;
        this.fields = ThreadLocal.withInitial(() -> new DfpField(digits));
    }

    public int getDigits() {
        return digits;
    }

    @Override
    public ThermalCorrection evaluate(double x, double gamma) {
        if (!Double.isFinite(x) || !Double.isFinite(gamma)) {
            return ThermalCorrection.UNDEFINED;
        }
        DfpField field = fields.get();
        field.clearIEEEFlags();

        Dfp one = field.getOne();
        Dfp two = field.newDfp(2);
        Dfp three = field.newDfp(3);
        Dfp dx = field.newDfp(x);
        Dfp gammaMinusOne = field.newDfp(gamma).subtract(one);

        Dfp exp = DfpMath.exp(dx);
        Dfp expNeg = one.divide(exp);
        Dfp sinh = exp.subtract(expNeg).divide(two);
        Dfp cosh = exp.add(expNeg).divide(two);
        Dfp sin = DfpMath.sin(dx);
        Dfp cos = DfpMath.cos(dx);

        Dfp coshMinusCos = cosh.subtract(cos);
        Dfp sinhMinusSin = sinh.subtract(sin);

        Dfp t1 = dx.multiply(sinh.add(sin)).subtract(two.multiply(coshMinusCos));
        Dfp t2 = dx.multiply(dx).multiply(coshMinusCos)
                .add(three.multiply(gammaMinusOne).multiply(dx).multiply(sinhMinusSin));
        Dfp dampingRatio = three.multiply(gammaMinusOne).multiply(t1).divide(t2);

        Dfp stiffness = one.add(three.multiply(gammaMinusOne).divide(dx).multiply(sinhMinusSin).divide(coshMinusCos));
        Dfp polytropicFactor = one.divide(one.add(dampingRatio.multiply(dampingRatio)).multiply(stiffness));

        return new ThermalCorrection(polytropicFactor.toDouble(), dampingRatio.toDouble());
    }
}
