package seaecho.physics.scattering;

import lombok.extern.slf4j.Slf4j;
import seaecho.config.EngineConfig;
import seaecho.physics.scattering.impl.AinslieLeightonModel;
import seaecho.physics.scattering.impl.AndersonModalModel;
import seaecho.physics.scattering.impl.AndreevaWestonModel;
import seaecho.physics.scattering.impl.BreathingModel;
import seaecho.physics.scattering.impl.ElasticSphereModalModel;
import seaecho.physics.scattering.impl.MedwinClayModel;
import seaecho.physics.scattering.impl.ThuraisinghamModel;
import seaecho.physics.scattering.impl.WildtMedwinModel;
import seaecho.physics.solver.impl.ResonanceDampingSolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro inmutable de modelos de dispersión, indexados por nombre.
 * <p>
 * Se construye una vez y se comparte en solo lectura entre todos los trabajadores.
 * Añadir un modelo produce un registro nuevo ({@link #withModel(ScatteringModel)}).
 */
@Slf4j
public final class ScatteringModelRegistry {

    private final Map<String, ScatteringModel> models;

    public ScatteringModelRegistry(Collection<? extends ScatteringModel> models) {
        Map<String, ScatteringModel> byName = new LinkedHashMap<>();
        for (ScatteringModel model : models) {
            if (byName.putIfAbsent(model.getName(), model) != null) {
                throw new IllegalArgumentException("Modelo registrado dos veces: " + model.getName());
            }
        }
        this.models = Collections.unmodifiableMap(byName);
    }

    /**
     * Registro con los ocho modelos de la biblioteca, compartiendo un único solver de resonancia.
     */
    public static ScatteringModelRegistry createDefault(ResonanceDampingSolver solver) {
        return new ScatteringModelRegistry(List.of(
                new MedwinClayModel(solver),
                new BreathingModel(solver),
                new ThuraisinghamModel(solver),
                new AndersonModalModel(),
                new WildtMedwinModel(solver),
                new AndreevaWestonModel(solver),
                new AinslieLeightonModel(),
                new ElasticSphereModalModel()
        ));
    }

    public static ScatteringModelRegistry createDefault(EngineConfig config) {
        return createDefault(new ResonanceDampingSolver(config));
    }

    /**
     * Copia de este registro con un modelo más.
     *
     * @throws IllegalArgumentException si ya existe un modelo con ese nombre.
     */
    public ScatteringModelRegistry withModel(ScatteringModel model) {
        List<ScatteringModel> extended = new ArrayList<>(models.values());
        extended.add(model);
        log.debug("Registrando modelo adicional: {}", model.getName());
        return new ScatteringModelRegistry(extended);
    }

    public Optional<ScatteringModel> find(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public ScatteringModel resolve(String name) {
        return resolveAll(List.of(name)).get(0);
    }

    /**
     * Resuelve todos los nombres en el orden dado.
     *
     * @throws UnknownModelException con la lista completa de nombres inválidos.
     */
    public List<ScatteringModel> resolveAll(List<String> names) {
        List<ScatteringModel> resolved = new ArrayList<>(names.size());
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            ScatteringModel model = models.get(name);
            if (model == null) {
                unknown.add(name);
            } else {
                resolved.add(model);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownModelException(unknown, getModelNames());
        }
        return resolved;
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    public List<String> getModelNames() {
        return List.copyOf(models.keySet());
    }
}
