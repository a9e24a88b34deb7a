package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.ScattererType;
import seaecho.physics.scattering.ScatteringComputationException;
import seaecho.physics.scattering.ScatteringModel;

/**
 * Base de los modelos: nombre, tipo de dispersor y conversión de sección eficaz a TS.
 */
public abstract class AbstractScatteringModel implements ScatteringModel {

    private final String name;
    private final ScattererType scattererType;

    protected AbstractScatteringModel(String name, ScattererType scattererType) {
        this.name = name;
        this.scattererType = scattererType;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ScattererType getScattererType() {
        return scattererType;
    }

    /**
     * Comprueba que el dispersor es del tipo del modelo.
     */
    protected void checkSupported(Scatterer scatterer) {
        if (!supports(scatterer)) {
            throw new IllegalArgumentException("El modelo " + name + " solo admite dispersores " + scattererType
                    + ", recibido: " + (scatterer == null ? "null" : scatterer.type()));
        }
    }

    /**
     * {@code TS = 10·log10(σ)}. Un NaN es un error de cálculo, nunca un dato.
     */
    protected double toTargetStrength(double sigma, double frequencyKhz) {
        double ts = 10.0 * Math.log10(sigma);
        if (Double.isNaN(ts)) {
            throw new ScatteringComputationException("TS no finito (sigma=" + sigma + ")", name, frequencyKhz);
        }
        return ts;
    }

    @Override
    public String toString() {
        return name;
    }
}
