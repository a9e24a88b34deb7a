package seaecho.physics.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.ScattererType;
import seaecho.domain.water.SeawaterState;
import seaecho.physics.scattering.ScatteringModel;
import seaecho.physics.solver.impl.ResonanceDampingSolver;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Unidad de trabajo autocontenida: evalúa todos los modelos solicitados en un único
 * punto (frecuencia, dispersor) del barrido.
 * <p>
 * Solo lee estado inmutable compartido (agua, dispersor, modelos) y escribe en sus
 * propios campos de resultado.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class ScatteringPointTask implements Callable<ScatteringPointTask> {

    // --- Entradas ---
    private final double frequencyKhz;
    private final Scatterer scatterer;
    private final SeawaterState water;
    private final List<ScatteringModel> models;

    // --- Resultados ---
    private double ka;
    private double[] targetStrengths;

    @Override
    public ScatteringPointTask call() {
        final double soundSpeed = water.soundSpeed();
        this.ka = ResonanceDampingSolver.ka(frequencyKhz, scatterer.radius(), soundSpeed);
        if (isOutsideSmallBubbleLimit()) {
            log.debug("ka={} > 1 en f={} kHz, a={} m: fuera de la hipótesis de burbuja pequeña.",
                    ka, frequencyKhz, scatterer.radius());
        }

        this.targetStrengths = new double[models.size()];
        for (int m = 0; m < models.size(); m++) {
            targetStrengths[m] = models.get(m).calculateTs(frequencyKhz, soundSpeed, water, scatterer);
        }
        return this;
    }

    /**
     * @return true si el dispersor es una burbuja y el punto viola la hipótesis de burbuja
     * pequeña (ka > 1). La solución modal de las esferas sólidas no tiene esa restricción.
     */
    public boolean isOutsideSmallBubbleLimit() {
        return scatterer.type() == ScattererType.GAS_BUBBLE && ka > 1.0;
    }
}
