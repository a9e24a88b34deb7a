package seaecho.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathRuntimeException;
import seaecho.physics.solver.CorrectionEvaluator;

import java.util.Objects;

/**
 * Cadena de precisión: intenta el evaluador primario y, si el resultado no es finito
 * o la aritmética falla, repite el cálculo con el secundario.
 * <p>
 * Si ambos fallan devuelve el resultado no finito; la decisión de qué hacer con él
 * es del solver de resonancia.
 */
@Slf4j
public class FallbackCorrectionEvaluator implements CorrectionEvaluator {

    private final CorrectionEvaluator primary;
    private final CorrectionEvaluator secondary;

    public FallbackCorrectionEvaluator(CorrectionEvaluator primary, CorrectionEvaluator secondary) {
        this.primary = Objects.requireNonNull(primary);
        this.secondary = Objects.requireNonNull(secondary);
    }

    @Override
    public ThermalCorrection evaluate(double x, double gamma) {
        ThermalCorrection result;
        try {
            result = primary.evaluate(x, gamma);
        } catch (MathRuntimeException | ArithmeticException e) {
            log.warn("Fallo en la aritmética extendida (X={}): {}. Reintentando en doble precisión.", x, e.getMessage());
            return secondary.evaluate(x, gamma);
        }
        if (result.isFinite()) {
            return result;
        }
        log.debug("Corrección no finita con {} (X={}). Reintentando con {}.",
                primary.getClass().getSimpleName(), x, secondary.getClass().getSimpleName());
        return secondary.evaluate(x, gamma);
    }
}
