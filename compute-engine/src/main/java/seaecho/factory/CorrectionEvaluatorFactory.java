package seaecho.factory;

import seaecho.config.EngineConfig;
import seaecho.physics.solver.CorrectionEvaluator;
import seaecho.physics.solver.impl.DoublePrecisionCorrectionEvaluator;
import seaecho.physics.solver.impl.ExtendedPrecisionCorrectionEvaluator;
import seaecho.physics.solver.impl.FallbackCorrectionEvaluator;

/**
 * Traduce la política de precisión de {@link EngineConfig} a un {@link CorrectionEvaluator}.
 */
public final class CorrectionEvaluatorFactory {

    private CorrectionEvaluatorFactory() {
    }

    public static CorrectionEvaluator create(EngineConfig config) {
        switch (config.getPrecisionPolicy()) {
            case EXTENDED:
                return new FallbackCorrectionEvaluator(
                        new ExtendedPrecisionCorrectionEvaluator(config.getExtendedPrecisionDigits()),
                        new DoublePrecisionCorrectionEvaluator());
            case DOUBLE:
                return new DoublePrecisionCorrectionEvaluator();
            default:
                throw new IllegalArgumentException("Política de precisión no soportada: " + config.getPrecisionPolicy());
        }
    }
}
