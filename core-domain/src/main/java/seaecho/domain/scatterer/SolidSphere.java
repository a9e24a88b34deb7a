package seaecho.domain.scatterer;

import java.util.Objects;

/**
 * Esfera sólida elástica de un material del catálogo.
 *
 * @param radius   Radio [m].
 * @param material Material.
 */
public record SolidSphere(double radius, SolidMaterial material) implements Scatterer {

    public SolidSphere {
        Objects.requireNonNull(material, "El material no puede ser nulo.");
    }

    @Override
    public ScattererType type() {
        return ScattererType.SOLID_SPHERE;
    }
}
