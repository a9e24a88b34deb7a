package seaecho.physics.scattering.impl;

import org.apache.commons.math3.complex.Complex;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.scatterer.SolidMaterial;
import seaecho.domain.scatterer.SolidSphere;
import seaecho.domain.water.SeawaterState;
import seaecho.utils.SphericalBessel;

/**
 * Solución modal de Faran (1951) para una esfera elástica sólida, en la forma
 * de MacLennan y Dunn usada para esferas de calibración.
 * <p>
 * Cada orden aporta un desfase η_n que combina la dispersión rígida (δ_n) con la
 * respuesta elástica del material (Φ_n, ondas longitudinales y transversales).
 */
public class ElasticSphereModalModel extends AbstractScatteringModel {

    public static final String NAME = "Elastic_Sphere_Modal";

    public ElasticSphereModalModel() {
        super(NAME, ScattererType.SOLID_SPHERE);
    }

    @Override
    public double calculateTs(double frequencyKhz, double soundSpeed, SeawaterState water, Scatterer scatterer) {
        checkSupported(scatterer);
        SolidSphere sphere = (SolidSphere) scatterer;
        double sigma = backscatteringCrossSection(frequencyKhz, soundSpeed, water.density(), sphere);
        return toTargetStrength(sigma, frequencyKhz);
    }

    private double backscatteringCrossSection(double frequencyKhz, double soundSpeed, double waterDensity,
                                              SolidSphere sphere) {
        final SolidMaterial material = sphere.material();
        final double a = sphere.radius();
        final double omega = 2.0 * Math.PI * frequencyKhz * 1000.0;

        final double x = omega * a / soundSpeed;
        final double x1 = omega * a / material.longitudinalSpeed();
        final double x2 = omega * a / material.transverseSpeed();
        final double halfX2Squared = x2 * x2 / 2.0;
        final double densityRatio = waterDensity / material.density();
        final int nMax = SphericalBessel.truncationOrder(x);

        double[] j = SphericalBessel.firstKind(nMax, x);
        double[] y = SphericalBessel.secondKind(nMax, x);
        double[] j1 = SphericalBessel.firstKind(nMax, x1);
        double[] j2 = SphericalBessel.firstKind(nMax, x2);
        double[] dj = SphericalBessel.derivative(j, x);
        double[] dy = SphericalBessel.derivative(y, x);
        double[] dj1 = SphericalBessel.derivative(j1, x1);
        double[] dj2 = SphericalBessel.derivative(j2, x2);

        Complex sum = Complex.ZERO;
        for (int n = 0; n <= nMax; n++) {
            double nn = n * (n + 1.0);

            double tanDelta = -j[n] / y[n];
            double tanAlpha = -x * dj[n] / j[n];
            double tanBeta = -x * dy[n] / y[n];
            double tanAlpha1 = -x1 * dj1[n] / j1[n];
            double tanAlpha2 = -x2 * dj2[n] / j2[n];

            double shear = nn - 1.0 - halfX2Squared + tanAlpha2;
            double numerator = nn / shear - tanAlpha1 / (tanAlpha1 + 1.0);
            double denominator = (nn - halfX2Squared + 2.0 * tanAlpha1) / (tanAlpha1 + 1.0)
                    - nn * (tanAlpha2 + 1.0) / shear;
            double tanPhi = -densityRatio * halfX2Squared * numerator / denominator;

            double tanEta = tanDelta * (tanPhi + tanAlpha) / (tanPhi + tanBeta);
            double eta = Math.atan(tanEta);

            double weight = ((n % 2 == 0) ? 1.0 : -1.0) * (2 * n + 1) * Math.sin(eta);
            sum = sum.add(new Complex(Math.cos(eta), Math.sin(eta)).multiply(weight));
        }

        double formFunction = 2.0 / x * sum.abs();
        double amplitude = a * formFunction / 2.0;
        return amplitude * amplitude;
    }
}
