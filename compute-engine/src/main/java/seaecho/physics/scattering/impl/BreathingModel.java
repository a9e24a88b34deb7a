package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

/**
 * Modo de respiración (monopolo) de una burbuja pequeña:
 * {@code σ = a² / ((f_R²/f² − 1)² + δ²)}.
 */
public class BreathingModel extends AbstractResonantBubbleModel {

    public static final String NAME = "Breathing";

    public BreathingModel(ResonanceDampingSolver solver) {
        this(NAME, solver);
    }

    protected BreathingModel(String name, ResonanceDampingSolver solver) {
        super(name, solver);
    }

    @Override
    protected double resonantCrossSection(double frequencyHz, double soundSpeed, BubbleState bubble, Response response) {
        return breathingCrossSection(bubble.radius(), response.resonanceFrequency(), frequencyHz, response.totalDamping());
    }

    static double breathingCrossSection(double radius, double resonanceFrequency, double frequencyHz, double damping) {
        double ratio = resonanceFrequency / frequencyHz;
        double detuning = ratio * ratio - 1.0;
        return radius * radius / (detuning * detuning + damping * damping);
    }
}
