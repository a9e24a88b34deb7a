package seaecho.physics.scattering;

import java.util.List;

/**
 * Uno o más nombres de modelo no están registrados.
 * <p>
 * Se lanza antes de evaluar ningún punto y lista todos los nombres inválidos,
 * no solo el primero.
 */
public class UnknownModelException extends IllegalArgumentException {

    private final List<String> unknownModels;
    private final List<String> availableModels;

    public UnknownModelException(List<String> unknownModels, List<String> availableModels) {
        super("Modelos desconocidos: " + unknownModels + ". Disponibles: " + availableModels);
        this.unknownModels = List.copyOf(unknownModels);
        this.availableModels = List.copyOf(availableModels);
    }

    public List<String> getUnknownModels() {
        return unknownModels;
    }

    public List<String> getAvailableModels() {
        return availableModels;
    }
}
