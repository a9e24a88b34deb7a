package seaecho.domain.scatterer;

/**
 * Familias de dispersores soportadas por el motor.
 */
public enum ScattererType {
    GAS_BUBBLE,
    SOLID_SPHERE
}
