package seaecho.physics.simulator;

/**
 * Fallo de un barrido completo. La causa es siempre el error original del trabajador
 * (o la {@link InterruptedException} si el hilo coordinador fue interrumpido).
 */
public class SweepExecutionException extends RuntimeException {

    public SweepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
