package seaecho.physics.model;

import lombok.extern.slf4j.Slf4j;
import seaecho.domain.water.SeawaterState;

/**
 * Modelo del agua de mar basado en correlaciones empíricas.
 * <ul>
 * <li>Densidad: ecuación de estado UNESCO (1981) a una atmósfera.</li>
 * <li>Velocidad del sonido: Mackenzie (1981).</li>
 * <li>Viscosidad dinámica: Sharqawy et al. (2010).</li>
 * <li>Presión de vapor: ASHRAE con corrección por salinidad (ley de Raoult).</li>
 * <li>Tensión superficial: IAPWS con corrección por salinidad.</li>
 * <li>Calor específico: Millero et al. (1973).</li>
 * </ul>
 * Sin estado: una única instancia puede compartirse entre hilos.
 */
@Slf4j
public class EmpiricalSeawaterModel implements EnvironmentModel {

    public static final double ATMOSPHERIC_PRESSURE = 1.01e5; // Pa
    public static final double GRAVITY = 9.81; // m/s²

    private static final double KELVIN_OFFSET = 273.15;
    private static final double CRITICAL_TEMPERATURE = 647.096; // K

    @Override
    public SeawaterState derive(double temperature, double depth, double salinity, double ph) {
        if (!Double.isFinite(temperature) || !Double.isFinite(depth) || !Double.isFinite(salinity)) {
            throw new IllegalArgumentException("Entradas ambientales no finitas: T=" + temperature + ", z=" + depth + ", S=" + salinity);
        }
        if (depth < 0.0 || salinity < 0.0) {
            throw new IllegalArgumentException("La profundidad y la salinidad deben ser >= 0: z=" + depth + ", S=" + salinity);
        }

        double density = density(temperature, salinity);
        double soundSpeed = soundSpeed(temperature, depth, salinity);
        double mu = dynamicViscosity(temperature, salinity);

        SeawaterState state = SeawaterState.builder()
                .temperature(temperature)
                .depth(depth)
                .salinity(salinity)
                .density(density)
                .soundSpeed(soundSpeed)
                .dynamicViscosity(mu)
                .kinematicViscosity(mu / density)
                .pressure(ATMOSPHERIC_PRESSURE + density * GRAVITY * depth)
                .vaporPressure(vaporPressure(temperature, salinity))
                .surfaceTension(surfaceTension(temperature, salinity))
                .specificHeat(specificHeat(temperature, salinity))
                .ph(ph)
                .build();

        log.debug("Estado del agua derivado: T={} °C, z={} m, S={} psu -> rho={} kg/m³, c={} m/s",
                temperature, depth, salinity, density, soundSpeed);
        return state;
    }

    /**
     * Densidad [kg/m³] a presión atmosférica (UNESCO 1981).
     */
    public static double density(double t, double s) {
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;
        double t5 = t4 * t;

        double pureWater = 999.842594 + 6.793952e-2 * t - 9.095290e-3 * t2
                + 1.001685e-4 * t3 - 1.120083e-6 * t4 + 6.536332e-9 * t5;
        double a = 8.24493e-1 - 4.0899e-3 * t + 7.6438e-5 * t2 - 8.2467e-7 * t3 + 5.3875e-9 * t4;
        double b = -5.72466e-3 + 1.0227e-4 * t - 1.6546e-6 * t2;
        double c = 4.8314e-4;

        return pureWater + a * s + b * Math.pow(s, 1.5) + c * s * s;
    }

    /**
     * Velocidad del sonido [m/s] (Mackenzie 1981).
     */
    public static double soundSpeed(double t, double z, double s) {
        return 1448.96 + 4.591 * t - 5.304e-2 * t * t + 2.374e-4 * t * t * t
                + 1.340 * (s - 35.0) + 1.630e-2 * z + 1.675e-7 * z * z
                - 1.025e-2 * t * (s - 35.0) - 7.139e-13 * t * z * z * z;
    }

    /**
     * Viscosidad dinámica [Pa·s] (Sharqawy et al. 2010).
     */
    public static double dynamicViscosity(double t, double s) {
        double muPure = 4.2844e-5 + 1.0 / (0.157 * Math.pow(t + 64.993, 2) - 91.296);
        double sKg = s / 1000.0;
        double a = 1.541 + 1.998e-2 * t - 9.52e-5 * t * t;
        double b = 7.974 - 7.561e-2 * t + 4.724e-4 * t * t;
        return muPure * (1.0 + a * sKg + b * sKg * sKg);
    }

    /**
     * Presión de vapor [Pa] (ASHRAE) reducida por la salinidad.
     */
    public static double vaporPressure(double t, double s) {
        double tk = t + KELVIN_OFFSET;
        double lnPv = -5800.2206 / tk + 1.3914993 - 0.048640239 * tk
                + 4.1764768e-5 * tk * tk - 1.4452093e-8 * tk * tk * tk
                + 6.5459673 * Math.log(tk);
        double pure = Math.exp(lnPv);
        return pure / (1.0 + 0.57357 * s / (1000.0 - s));
    }

    /**
     * Tensión superficial agua/aire [N/m] (IAPWS con corrección de salinidad).
     */
    public static double surfaceTension(double t, double s) {
        double tau = 1.0 - (t + KELVIN_OFFSET) / CRITICAL_TEMPERATURE;
        double pure = 0.2358 * Math.pow(tau, 1.256) * (1.0 - 0.625 * tau);
        return pure * (1.0 + 3.766e-4 * s + 2.347e-6 * s * t);
    }

    /**
     * Calor específico a presión constante [J/(kg·K)] (Millero et al. 1973).
     */
    public static double specificHeat(double t, double s) {
        double t2 = t * t;
        double pure = 4217.4 - 3.720283 * t + 0.1412855 * t2 - 2.654387e-3 * t2 * t + 2.093236e-5 * t2 * t2;
        double a = -7.6444 + 0.107276 * t - 1.3839e-3 * t2;
        double b = 0.17709 - 4.0772e-3 * t + 5.3539e-5 * t2;
        return pure + a * s + b * Math.pow(s, 1.5);
    }
}
