package seaecho.physics.scattering.impl;

import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.water.SeawaterState;
import seaecho.physics.solver.impl.ResonanceDampingSolver;
import seaecho.physics.solver.impl.ResonanceDampingSolver.Response;

import java.util.Objects;

/**
 * Base de los modelos de burbuja que dependen de la resonancia corregida y del
 * amortiguamiento total. Todos reciben ya aplicada la política de respaldo del solver.
 */
public abstract class AbstractResonantBubbleModel extends AbstractBubbleModel {

    protected final ResonanceDampingSolver solver;

    protected AbstractResonantBubbleModel(String name, ResonanceDampingSolver solver) {
        super(name);
        this.solver = Objects.requireNonNull(solver, "El solver de resonancia no puede ser nulo.");
    }

    @Override
    protected final double backscatteringCrossSection(double frequencyKhz, double soundSpeed,
                                                      SeawaterState water, BubbleState bubble) {
        Response response = solver.response(frequencyKhz, bubble, soundSpeed);
        return resonantCrossSection(frequencyKhz * 1000.0, soundSpeed, bubble, response);
    }

    /**
     * @param frequencyHz Frecuencia [Hz].
     * @param response    Resonancia y amortiguamiento efectivos.
     */
    protected abstract double resonantCrossSection(double frequencyHz, double soundSpeed,
                                                   BubbleState bubble, Response response);
}
