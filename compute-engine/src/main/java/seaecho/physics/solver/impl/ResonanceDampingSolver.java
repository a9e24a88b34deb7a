package seaecho.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import seaecho.config.EngineConfig;
import seaecho.domain.scatterer.BubbleState;
import seaecho.factory.CorrectionEvaluatorFactory;
import seaecho.physics.scattering.ScatteringComputationException;
import seaecho.physics.solver.CorrectionEvaluator;
import seaecho.physics.solver.CorrectionEvaluator.ThermalCorrection;

import java.util.Objects;

/**
 * Motor de resonancia y amortiguamiento de burbujas.
 * <p>
 * Calcula la frecuencia de respiración de Minnaert, la frecuencia de resonancia corregida
 * por conductividad térmica y tensión superficial, y la constante de amortiguamiento total
 * (re-radiación + térmica + viscosa). Aplica una única política de respaldo:
 * <ul>
 * <li>Si la frecuencia corregida es NaN se usa la de Minnaert y el amortiguamiento
 * pierde el término térmico.</li>
 * <li>Si aun así algo es NaN se lanza {@link ScatteringComputationException}.</li>
 * </ul>
 * Sin estado mutable: una instancia se comparte entre todos los hilos del barrido.
 * Las constantes de la corrección están en CGS, como en la formulación original de Medwin.
 */
@Slf4j
public class ResonanceDampingSolver {

    // Conversiones SI -> CGS
    private static final double PA_TO_DYN_PER_CM2 = 10.0;
    private static final double KG_M3_TO_G_CM3 = 1e-3;
    private static final double KJ_KG_K_TO_CAL_G_K = 0.2388;
    private static final double W_M_K_TO_CAL_S_CM_K = 0.0023900573613766683;
    private static final double N_M_TO_DYN_CM = 1e3;
    private static final double M_TO_CM = 1e2;

    private final CorrectionEvaluator correctionEvaluator;

    public ResonanceDampingSolver(CorrectionEvaluator correctionEvaluator) {
        this.correctionEvaluator = Objects.requireNonNull(correctionEvaluator, "El evaluador de corrección no puede ser nulo.");
    }

    public ResonanceDampingSolver(EngineConfig config) {
        this(CorrectionEvaluatorFactory.create(config));
    }

    /**
     * Número de onda adimensional {@code ka = (2π f / c) · a}.
     *
     * @param frequencyKhz Frecuencia [kHz].
     * @param radius       Radio [m].
     * @param soundSpeed   Velocidad del sonido en el agua [m/s].
     */
    public static double ka(double frequencyKhz, double radius, double soundSpeed) {
        return 2.0 * Math.PI * frequencyKhz * 1000.0 / soundSpeed * radius;
    }

    /**
     * Frecuencia de respiración de Minnaert [Hz], sin correcciones.
     */
    public static double breathingFrequency(BubbleState bubble) {
        double gamma = bubble.heatCapacityRatio();
        return 1.0 / (2.0 * Math.PI * bubble.radius())
                * Math.sqrt(3.0 * gamma * bubble.water().pressure() / bubble.water().density());
    }

    /**
     * Frecuencia de resonancia corregida a la frecuencia de trabajo dada.
     * No aplica respaldo: el resultado puede contener NaN.
     */
    public Resonance resonance(double frequencyKhz, BubbleState bubble) {
        final double a = bubble.radius();
        final double gamma = bubble.heatCapacityRatio();
        final double omega = 2.0 * Math.PI * frequencyKhz * 1000.0;
        final double fb = breathingFrequency(bubble);

        double pressureCgs = bubble.water().pressure() * PA_TO_DYN_PER_CM2;
        double gasDensityCgs = bubble.referenceGasDensity() * KG_M3_TO_G_CM3;
        double specificHeatCgs = bubble.specificHeat() * KJ_KG_K_TO_CAL_G_K;
        double conductivityCgs = bubble.thermalConductivity() * W_M_K_TO_CAL_S_CM_K;
        double surfaceTensionCgs = bubble.water().surfaceTension() * N_M_TO_DYN_CM;
        double radiusCgs = a * M_TO_CM;

        double x = radiusCgs * Math.sqrt(2.0 * omega * gasDensityCgs * specificHeatCgs / conductivityCgs);
        ThermalCorrection correction = correctionEvaluator.evaluate(x, gamma);
        double b = correction.polytropicFactor();

        double beta = 1.0 + 2.0 * surfaceTensionCgs / (pressureCgs * radiusCgs) * (1.0 - 1.0 / (3.0 * gamma * b));
        double fr = fb * Math.sqrt(b * beta);

        return new Resonance(fb, fr, correction.dampingRatio(), x);
    }

    /**
     * Los tres términos de amortiguamiento para una resonancia ya calculada.
     *
     * @param resonanceFrequency Frecuencia de resonancia a usar [Hz].
     * @param dampingRatio       Cociente d/b; NaN anula el término térmico.
     */
    public static Damping damping(double frequencyKhz, BubbleState bubble, double soundSpeed,
                                  double resonanceFrequency, double dampingRatio) {
        final double a = bubble.radius();
        final double frequencyHz = frequencyKhz * 1000.0;
        final double omega = 2.0 * Math.PI * frequencyHz;

        double radiation = omega * a / soundSpeed;
        double thermal = Double.isNaN(dampingRatio)
                ? 0.0
                : dampingRatio * Math.pow(resonanceFrequency / frequencyHz, 2);
        double viscous = 4.0 * bubble.water().dynamicViscosity() / (bubble.water().density() * omega * a * a);

        return new Damping(radiation, thermal, viscous);
    }

    /**
     * Frecuencia de resonancia y amortiguamiento total listos para los modelos,
     * con la política de respaldo ya aplicada.
     *
     * @throws ScatteringComputationException si ni siquiera el respaldo es finito.
     */
    public Response response(double frequencyKhz, BubbleState bubble, double soundSpeed) {
        Resonance resonance = resonance(frequencyKhz, bubble);

        if (!Double.isNaN(resonance.resonanceFrequency()) && !Double.isNaN(resonance.dampingRatio())) {
            Damping damping = damping(frequencyKhz, bubble, soundSpeed, resonance.resonanceFrequency(), resonance.dampingRatio());
            if (!Double.isNaN(damping.total())) {
                return new Response(resonance.breathingFrequency(), resonance.resonanceFrequency(), damping, false);
            }
        }

        // Respaldo: Minnaert sin término térmico
        log.debug("Corrección de resonancia no definida (f={} kHz, a={} m, X={}). Se usa la frecuencia de Minnaert.",
                frequencyKhz, bubble.radius(), resonance.thermalParameter());
        Damping fallback = damping(frequencyKhz, bubble, soundSpeed, resonance.breathingFrequency(), Double.NaN);
        if (Double.isNaN(resonance.breathingFrequency()) || Double.isNaN(fallback.total())) {
            throw new ScatteringComputationException(
                    "No se pudo obtener una resonancia finita ni con el respaldo de Minnaert para f=" + frequencyKhz
                            + " kHz y diámetro " + bubble.diameter() + " m");
        }
        return new Response(resonance.breathingFrequency(), resonance.breathingFrequency(), fallback, true);
    }

    /**
     * @param breathingFrequency Frecuencia de Minnaert f_b [Hz].
     * @param resonanceFrequency Frecuencia corregida f_R [Hz]. Puede ser NaN.
     * @param dampingRatio       Cociente d/b. Puede ser NaN.
     * @param thermalParameter   Parámetro adimensional X.
     */
    public record Resonance(double breathingFrequency, double resonanceFrequency, double dampingRatio,
                            double thermalParameter) {
    }

    /**
     * Términos adimensionales de amortiguamiento.
     */
    public record Damping(double radiation, double thermal, double viscous) {
        public double total() {
            return radiation + thermal + viscous;
        }
    }

    /**
     * @param breathingFrequency Frecuencia de Minnaert [Hz].
     * @param resonanceFrequency Frecuencia efectiva a usar por los modelos [Hz].
     * @param damping            Amortiguamiento efectivo.
     * @param fallbackApplied    true si se descartó la corrección térmica.
     */
    public record Response(double breathingFrequency, double resonanceFrequency, Damping damping,
                           boolean fallbackApplied) {
        public double totalDamping() {
            return damping.total();
        }
    }
}
