package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.water.SeawaterState;

/**
 * Base de los modelos de burbuja de gas.
 * Las subclases solo calculan la sección eficaz de retrodispersión.
 */
public abstract class AbstractBubbleModel extends AbstractScatteringModel {

    protected AbstractBubbleModel(String name) {
        super(name, ScattererType.GAS_BUBBLE);
    }

    @Override
    public final double calculateTs(double frequencyKhz, double soundSpeed, SeawaterState water, Scatterer scatterer) {
        checkSupported(scatterer);
        double sigma = backscatteringCrossSection(frequencyKhz, soundSpeed, water, (BubbleState) scatterer);
        return toTargetStrength(sigma, frequencyKhz);
    }

    /**
     * @return Sección eficaz de retrodispersión σ_bs [m²].
     */
    protected abstract double backscatteringCrossSection(double frequencyKhz, double soundSpeed,
                                                         SeawaterState water, BubbleState bubble);
}
