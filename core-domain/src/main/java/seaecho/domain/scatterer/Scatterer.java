package seaecho.domain.scatterer;

/**
 * Contrato común de los dispersores (burbujas de gas y esferas sólidas).
 * Las implementaciones son objetos de valor inmutables.
 */
public interface Scatterer {

    /**
     * Radio del dispersor [m].
     */
    double radius();

    /**
     * Diámetro del dispersor [m].
     */
    default double diameter() {
        return 2.0 * radius();
    }

    ScattererType type();
}
