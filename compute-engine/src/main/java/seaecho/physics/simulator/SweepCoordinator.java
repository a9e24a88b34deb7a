package seaecho.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import seaecho.config.EngineConfig;
import seaecho.config.ScatteringParameterSet;
import seaecho.domain.result.ScatteringResultSet;
import seaecho.domain.result.SweepAxis;
import seaecho.domain.scatterer.Scatterer;
import seaecho.domain.water.SeawaterState;
import seaecho.factory.ScattererFactory;
import seaecho.physics.impl.ScatteringPointTask;
import seaecho.physics.scattering.ScatteringModel;
import seaecho.physics.scattering.ScatteringModelRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Orquestador de barridos de Target Strength.
 * <p>
 * Responsabilidades:
 * 1. Validar el conjunto de parámetros y resolver los modelos antes de evaluar nada.
 * 2. Derivar una sola vez el agua y el dispersor, ambos inmutables.
 * 3. Repartir los puntos del barrido en un pool acotado y reensamblar los resultados
 * en el orden de entrada, con independencia del orden de finalización.
 * <p>
 * El resultado es bit a bit idéntico para cualquier tamaño de pool: cada punto es una
 * función pura de entradas inmutables. Un fallo en cualquier punto aborta el barrido.
 */
@Slf4j
public class SweepCoordinator implements AutoCloseable {

    private final EngineConfig config;
    private final ScatteringModelRegistry registry;
    private final ScattererFactory scattererFactory;
    private final ExecutorService threadPool;
    private final ParallelMapper mapper;

    public SweepCoordinator(EngineConfig config, ScatteringModelRegistry registry, ScattererFactory scattererFactory) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.registry = Objects.requireNonNull(registry, "El registro de modelos no puede ser nulo.");
        this.scattererFactory = Objects.requireNonNull(scattererFactory, "La fábrica de dispersores no puede ser nula.");
        int processorCount = Math.max(config.getCpuProcessorCount(), 1);
        this.threadPool = Executors.newFixedThreadPool(processorCount);
        this.mapper = new ParallelMapper(threadPool);
        log.info("SweepCoordinator inicializado. (Hilos: {}, Precisión: {}, Modelos: {})",
                processorCount, config.getPrecisionPolicy(), registry.getModelNames().size());
    }

    public SweepCoordinator(EngineConfig config) {
        this(config, ScatteringModelRegistry.createDefault(config), new ScattererFactory());
    }

    /**
     * Barrido en frecuencia con el dispersor del conjunto de parámetros.
     *
     * @throws IllegalArgumentException                              si los parámetros son inválidos o un modelo
     *                                                               no admite el tipo de dispersor.
     * @throws seaecho.physics.scattering.UnknownModelException     si algún modelo no está registrado.
     * @throws SweepExecutionException                              si algún punto falla.
     */
    public ScatteringResultSet runSweep(ScatteringParameterSet parameters) {
        Objects.requireNonNull(parameters, "El conjunto de parámetros no puede ser nulo.");
        long startTime = System.currentTimeMillis();

        parameters.validate();
        List<ScatteringModel> models = registry.resolveAll(parameters.models());

        SeawaterState water = scattererFactory.createWater(parameters);
        Scatterer scatterer = scattererFactory.createScatterer(parameters, water);
        checkApplicable(models, scatterer);

        final int pointCount = parameters.frequencyCount();
        log.info("Iniciando barrido en frecuencia: {} puntos, modelos {}, dispersor {} de {} m.",
                pointCount, parameters.models(), scatterer.type(), scatterer.diameter());

        List<ScatteringPointTask> tasks = new ArrayList<>(pointCount);
        for (int i = 0; i < pointCount; i++) {
            tasks.add(new ScatteringPointTask(parameters.frequencyAt(i), scatterer, water, models));
        }
        List<ScatteringPointTask> completed = mapper.map(tasks);

        double[] diameters = new double[pointCount];
        Arrays.fill(diameters, scatterer.diameter());
        ScatteringResultSet result = assemble(parameters, SweepAxis.FREQUENCY, parameters.frequencies(), diameters,
                completed, models, water, scatterer, startTime);

        log.info("Barrido en frecuencia completado: {} puntos en {} ms.", pointCount, result.getComputationTime());
        return result;
    }

    /**
     * Barrido en diámetro a frecuencia fija. El tipo de dispersor, el gas, el material, el entorno
     * y los modelos se toman del conjunto de parámetros; su array de frecuencias se ignora.
     *
     * @param frequencyKhz Frecuencia fija [kHz].
     * @param diameters    Diámetros a evaluar [m], en el orden en que se devolverán.
     */
    public ScatteringResultSet runDiameterSweep(ScatteringParameterSet parameters, double frequencyKhz, double[] diameters) {
        Objects.requireNonNull(parameters, "El conjunto de parámetros no puede ser nulo.");
        long startTime = System.currentTimeMillis();

        if (!(frequencyKhz > 0.0) || Double.isInfinite(frequencyKhz)) {
            throw new IllegalArgumentException("La frecuencia del barrido en diámetro debe ser positiva: " + frequencyKhz + " kHz");
        }
        if (diameters == null || diameters.length == 0) {
            throw new IllegalArgumentException("La secuencia de diámetros no puede estar vacía.");
        }
        final double[] axis = diameters.clone();
        for (double diameter : axis) {
            ScatteringParameterSet.validateDiameter(diameter);
        }
        parameters.validateModels();
        parameters.validateEnvironment();
        List<ScatteringModel> models = registry.resolveAll(parameters.models());

        SeawaterState water = scattererFactory.createWater(parameters);
        List<ScatteringPointTask> tasks = new ArrayList<>(axis.length);
        Scatterer reference = null;
        for (double diameter : axis) {
            Scatterer scatterer = scattererFactory.createScatterer(parameters, water, diameter);
            if (reference == null) {
                reference = scatterer;
                checkApplicable(models, reference);
            }
            tasks.add(new ScatteringPointTask(frequencyKhz, scatterer, water, models));
        }

        log.info("Iniciando barrido en diámetro: {} puntos a {} kHz, modelos {}.", axis.length, frequencyKhz, parameters.models());
        List<ScatteringPointTask> completed = mapper.map(tasks);

        double[] frequencies = new double[axis.length];
        Arrays.fill(frequencies, frequencyKhz);
        ScatteringResultSet result = assemble(parameters, SweepAxis.DIAMETER, frequencies, axis,
                completed, models, water, reference, startTime);

        log.info("Barrido en diámetro completado: {} puntos en {} ms.", axis.length, result.getComputationTime());
        return result;
    }

    private void checkApplicable(List<ScatteringModel> models, Scatterer scatterer) {
        List<String> rejected = new ArrayList<>();
        for (ScatteringModel model : models) {
            if (!model.supports(scatterer)) {
                rejected.add(model.getName());
            }
        }
        if (!rejected.isEmpty()) {
            throw new IllegalArgumentException("Los modelos " + rejected + " no admiten dispersores de tipo " + scatterer.type());
        }
    }

    private ScatteringResultSet assemble(ScatteringParameterSet parameters, SweepAxis axis,
                                         double[] frequencies, double[] diameters,
                                         List<ScatteringPointTask> completed, List<ScatteringModel> models,
                                         SeawaterState water, Scatterer reference, long startTime) {
        final int pointCount = completed.size();
        double[] ka = new double[pointCount];
        Map<String, double[]> ts = new LinkedHashMap<>();
        for (ScatteringModel model : models) {
            ts.put(model.getName(), new double[pointCount]);
        }

        int outsideLimit = 0;
        double maxKa = 0.0;
        for (int i = 0; i < pointCount; i++) {
            ScatteringPointTask task = completed.get(i);
            ka[i] = task.getKa();
            if (task.isOutsideSmallBubbleLimit()) {
                outsideLimit++;
                maxKa = Math.max(maxKa, ka[i]);
            }
            double[] values = task.getTargetStrengths();
            for (int m = 0; m < models.size(); m++) {
                ts.get(models.get(m).getName())[i] = values[m];
            }
        }

        if (outsideLimit > 0) {
            log.warn("{} de {} puntos superan ka = 1 (máximo ka = {}). Los modelos de burbuja pequeña pierden validez.",
                    outsideLimit, pointCount, maxKa);
        }

        return new ScatteringResultSet(parameters, axis, frequencies, diameters, ka, ts, water, reference,
                System.currentTimeMillis() - startTime);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public ScatteringModelRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        log.info("Cerrando el pool de hilos del SweepCoordinator.");
        threadPool.shutdown();
    }
}
