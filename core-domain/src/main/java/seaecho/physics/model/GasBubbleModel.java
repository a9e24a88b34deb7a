package seaecho.physics.model;

import seaecho.domain.scatterer.BubbleState;
import seaecho.domain.scatterer.GasProperties;
import seaecho.domain.water.SeawaterState;

/**
 * Contrato para los modelos que derivan el estado de una burbuja de gas
 * a partir de su diámetro y del agua que la rodea.
 */
public interface GasBubbleModel {

    /**
     * @param diameter Diámetro de la burbuja [m].
     * @param gas      Constantes del gas.
     * @param water    Estado del agua circundante.
     * @return Estado inmutable de la burbuja.
     * @throws IllegalArgumentException si el diámetro no es positivo y finito.
     */
    BubbleState derive(double diameter, GasProperties gas, SeawaterState water);
}
