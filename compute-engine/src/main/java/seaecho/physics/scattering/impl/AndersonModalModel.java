package seaecho.physics.scattering.impl;

import org.apache.commons.math3.complex.Complex;
import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.water.SeawaterState;
import seaecho.utils.SphericalBessel;

/**
 * Solución modal de Anderson (1950) para una esfera fluida, con el gas de la burbuja
 * como fluido interior.
 * <p>
 * No usa la corrección de resonancia: el pico de Minnaert aparece de forma natural en el
 * término n = 0 y el único amortiguamiento es el de re-radiación.
 */
public class AndersonModalModel extends AbstractBubbleModel {

    public static final String NAME = "Modal";

    public AndersonModalModel() {
        super(NAME);
    }

    @Override
    protected double backscatteringCrossSection(double frequencyKhz, double soundSpeed,
                                                SeawaterState water, BubbleState bubble) {
        final double a = bubble.radius();
        final double omega = 2.0 * Math.PI * frequencyKhz * 1000.0;
        final double k = omega / soundSpeed;
        final double gasSoundSpeed = bubble.gasSoundSpeed();

        // Contrastes de densidad y de velocidad gas/agua
        final double g = bubble.gasDensity() / water.density();
        final double h = gasSoundSpeed / soundSpeed;

        final double x = k * a;
        final double xInner = omega / gasSoundSpeed * a;
        final int nMax = SphericalBessel.truncationOrder(Math.max(x, xInner));

        double[] j = SphericalBessel.firstKind(nMax, x);
        double[] y = SphericalBessel.secondKind(nMax, x);
        double[] jInner = SphericalBessel.firstKind(nMax, xInner);
        double[] dj = SphericalBessel.derivative(j, x);
        double[] dy = SphericalBessel.derivative(y, x);
        double[] djInner = SphericalBessel.derivative(jInner, xInner);

        Complex sum = Complex.ZERO;
        for (int n = 0; n <= nMax; n++) {
            double innerRatio = djInner[n] / (jInner[n] * dj[n]);
            double numerator = innerRatio * y[n] - g * h * dy[n] / dj[n];
            double denominator = innerRatio * j[n] - g * h;
            double cn = numerator / denominator;

            double weight = ((n % 2 == 0) ? 1.0 : -1.0) * (2 * n + 1);
            sum = sum.add(new Complex(weight, 0.0).divide(new Complex(1.0, cn)));
        }

        // f_bs = (-i/k) Σ ...
        Complex formFunction = sum.multiply(new Complex(0.0, -1.0 / k));
        double magnitude = formFunction.abs();
        return magnitude * magnitude;
    }
}
