package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

/**
 * Wildt (1946) en la forma de Medwin: resonancia de Minnaert sin corregir
 * con el amortiguamiento total efectivo.
 */
public class WildtMedwinModel extends AbstractResonantBubbleModel {

    public static final String NAME = "Wildt_Medwin";

    public WildtMedwinModel(ResonanceDampingSolver solver) {
        super(NAME, solver);
    }

    @Override
    protected double resonantCrossSection(double frequencyHz, double soundSpeed, BubbleState bubble, Response response) {
        return BreathingModel.breathingCrossSection(
                bubble.radius(), response.breathingFrequency(), frequencyHz, response.totalDamping());
    }
}
