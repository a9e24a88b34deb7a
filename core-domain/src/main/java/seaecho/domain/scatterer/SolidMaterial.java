package seaecho.domain.scatterer;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Catálogo estático de materiales elásticos para esferas de calibración.
 * <p>
 * Solo datos: densidad y velocidades longitudinal y transversal.
 */
public enum SolidMaterial {
    /**
     * MacLennan y Dunn (1984), Foote (1990).
     */
    TUNGSTEN_CARBIDE(14900.0, 6853.0, 4171.0),
    /**
     * Cobre sólido a unos 25 °C.
     */
    COPPER(8940.0, 4660.0, 2325.0),
    ALUMINUM(2700.0, 6260.0, 3080.0),
    STAINLESS_STEEL(7800.0, 5610.0, 3120.0);

    private final double density;
    private final double longitudinalSpeed;
    private final double transverseSpeed;

    SolidMaterial(double density, double longitudinalSpeed, double transverseSpeed) {
        this.density = density;
        this.longitudinalSpeed = longitudinalSpeed;
        this.transverseSpeed = transverseSpeed;
    }

    /**
     * Densidad [kg/m³].
     */
    public double density() {
        return density;
    }

    /**
     * Velocidad de las ondas longitudinales [m/s].
     */
    public double longitudinalSpeed() {
        return longitudinalSpeed;
    }

    /**
     * Velocidad de las ondas transversales (cizalla) [m/s].
     */
    public double transverseSpeed() {
        return transverseSpeed;
    }

    /**
     * Búsqueda por nombre insensible a mayúsculas ("copper", "Tungsten-Carbide"...).
     *
     * @throws IllegalArgumentException si el material no está en el catálogo.
     */
    @JsonCreator
    public static SolidMaterial fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("El nombre del material no puede ser nulo.");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (SolidMaterial material : values()) {
            if (material.name().equals(normalized)) {
                return material;
            }
        }
        throw new IllegalArgumentException("Material desconocido: '" + name + "'. Disponibles: "
                + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
    }
}
