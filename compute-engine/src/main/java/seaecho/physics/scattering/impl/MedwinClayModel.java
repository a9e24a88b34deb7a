package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

/**
 * Medwin y Clay (1998): resonancia amortiguada con término de desintonía lineal
 * {@code σ = a² / ((f_R/f − 1)² + δ²)}.
 */
public class MedwinClayModel extends AbstractResonantBubbleModel {

    public static final String NAME = "Medwin_Clay";

    public MedwinClayModel(ResonanceDampingSolver solver) {
        super(NAME, solver);
    }

    @Override
    protected double resonantCrossSection(double frequencyHz, double soundSpeed, BubbleState bubble, Response response) {
        double a = bubble.radius();
        double detuning = response.resonanceFrequency() / frequencyHz - 1.0;
        double delta = response.totalDamping();
        return a * a / (detuning * detuning + delta * delta);
    }
}
