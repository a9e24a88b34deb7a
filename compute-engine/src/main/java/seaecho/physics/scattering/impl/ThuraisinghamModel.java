package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

/**
 * Thuraisingham (1997): modo de respiración con factor de tamaño finito
 * {@code (sin ka / ka)²}, que atenúa la respuesta cuando ka se acerca a 1.
 */
public class ThuraisinghamModel extends BreathingModel {

    public static final String NAME = "Thuraisingham";

    public ThuraisinghamModel(ResonanceDampingSolver solver) {
        super(NAME, solver);
    }

    @Override
    protected double resonantCrossSection(double frequencyHz, double soundSpeed, BubbleState bubble, Response response) {
        double ka = 2.0 * Math.PI * frequencyHz / soundSpeed * bubble.radius();
        double finiteSize = Math.sin(ka) / ka;
        return super.resonantCrossSection(frequencyHz, soundSpeed, bubble, response) * finiteSize * finiteSize;
    }
}
