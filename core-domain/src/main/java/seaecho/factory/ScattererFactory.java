package seaecho.factory;

import seaecho.config.ScatteringParameterSet;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.scatterer.SolidSphere;
import seaecho.domain.water.SeawaterState;
import seaecho.physics.model.EmpiricalSeawaterModel;
import seaecho.physics.model.EnvironmentModel;
import seaecho.physics.model.GasBubbleModel;
import seaecho.physics.model.IdealGasBubbleModel;

import java.util.Objects;

/**
 * Fábrica responsable de construir el agua y los dispersores de un barrido.
 * <p>
 * Encadena los modelos físicos en el orden natural:
 * <ol>
 * <li>El {@link EnvironmentModel} deriva el estado del agua a partir de (T, z, S).</li>
 * <li>Según el tipo de dispersor, el {@link GasBubbleModel} deriva la burbuja
 * o se construye la esfera sólida con su material.</li>
 * </ol>
 */
public class ScattererFactory {

    private final EnvironmentModel environmentModel;
    private final GasBubbleModel bubbleModel;

    public ScattererFactory() {
        this(new EmpiricalSeawaterModel(), new IdealGasBubbleModel());
    }

    public ScattererFactory(EnvironmentModel environmentModel, GasBubbleModel bubbleModel) {
        this.environmentModel = Objects.requireNonNull(environmentModel, "El modelo de entorno no puede ser nulo.");
        this.bubbleModel = Objects.requireNonNull(bubbleModel, "El modelo de burbuja no puede ser nulo.");
    }

    /**
     * Deriva el estado del agua descrito por el conjunto de parámetros.
     */
    public SeawaterState createWater(ScatteringParameterSet parameters) {
        parameters.validateEnvironment();
        return environmentModel.derive(parameters.temperature(), parameters.depth(), parameters.salinity(), parameters.ph());
    }

    /**
     * Construye el dispersor del conjunto de parámetros con su diámetro nominal.
     */
    public Scatterer createScatterer(ScatteringParameterSet parameters, SeawaterState water) {
        return createScatterer(parameters, water, parameters.diameter());
    }

    /**
     * Construye un dispersor del tipo y material del conjunto de parámetros con un diámetro arbitrario.
     * Usado por los barridos de diámetro.
     */
    public Scatterer createScatterer(ScatteringParameterSet parameters, SeawaterState water, double diameter) {
        ScatteringParameterSet.validateDiameter(diameter);
        switch (parameters.scattererType()) {
            case GAS_BUBBLE:
                return bubbleModel.derive(diameter, parameters.gasSpecies().properties(), water);
            case SOLID_SPHERE:
                return new SolidSphere(diameter / 2.0, parameters.material());
            default:
                throw new IllegalArgumentException("Tipo de dispersor no soportado: " + parameters.scattererType());
        }
    }
}
