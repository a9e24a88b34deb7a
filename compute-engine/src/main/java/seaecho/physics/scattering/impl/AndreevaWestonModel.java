package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

/**
 * Andreeva (1964) / Weston (1967): la respuesta resonante se funde con el límite
 * geométrico {@code a²/4} cuando ka crece.
 */
public class AndreevaWestonModel extends AbstractResonantBubbleModel {

    public static final String NAME = "Andreeva_Weston";

    public AndreevaWestonModel(ResonanceDampingSolver solver) {
        super(NAME, solver);
    }

    @Override
    protected double resonantCrossSection(double frequencyHz, double soundSpeed, BubbleState bubble, Response response) {
        double a = bubble.radius();
        double ka = 2.0 * Math.PI * frequencyHz / soundSpeed * a;
        double kaSquared = ka * ka;

        double resonant = BreathingModel.breathingCrossSection(
                a, response.resonanceFrequency(), frequencyHz, response.totalDamping());
        double geometric = a * a / 4.0;

        return resonant / (1.0 + kaSquared) + geometric * kaSquared / (1.0 + kaSquared);
    }
}
