package seaecho.physics.model;

import seaecho.domain.water.SeawaterState;

/**
 * Absorción en agua de mar según Ainslie y McColm (1998).
 * <p>
 * Suma de tres contribuciones: relajación del ácido bórico, relajación del sulfato de
 * magnesio y viscosidad pura. Válido aproximadamente entre 100 Hz y 1 MHz.
 */
public class AinslieMcColmAbsorptionModel implements AbsorptionModel {

    @Override
    public double absorption(double frequencyKhz, SeawaterState water) {
        final double t = water.temperature();
        final double s = water.salinity();
        final double zKm = water.depth() / 1000.0;
        final double f2sq = frequencyKhz * frequencyKhz;

        // Frecuencias de relajación [kHz]
        double fBoric = 0.78 * Math.sqrt(s / 35.0) * Math.exp(t / 26.0);
        double fMagnesium = 42.0 * Math.exp(t / 17.0);

        double boric = 0.106 * (fBoric * f2sq) / (f2sq + fBoric * fBoric)
                * Math.exp((water.ph() - 8.0) / 0.56);
        double magnesium = 0.52 * (1.0 + t / 43.0) * (s / 35.0)
                * (fMagnesium * f2sq) / (f2sq + fMagnesium * fMagnesium)
                * Math.exp(-zKm / 6.0);
        double pureWater = 0.00049 * f2sq * Math.exp(-(t / 27.0 + zKm / 17.0));

        return boric + magnesium + pureWater;
    }
}
