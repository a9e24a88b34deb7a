package seaecho.physics.simulator;

/**
 * Resultado de un trabajador etiquetado con la posición de su entrada.
 * Permite reordenar resultados que llegan en orden de finalización.
 */
public record IndexedResult<R>(int index, R value) {
}
