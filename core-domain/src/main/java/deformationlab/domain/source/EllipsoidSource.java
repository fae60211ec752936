package deformationlab.domain.source;

import deformationlab.physics.model.EllipsoidVolumeCalculator;
import lombok.Builder;
import lombok.With;

/**
 * Parámetros de una fuente puntual de deformación elipsoidal.
 * <p>
 * Objeto de valor inmutable: cada edición produce una instancia nueva mediante los métodos
 * {@code withX}. El volumen es un campo derivado y no forma parte del estado; se calcula a
 * partir de los tres semiejes, por lo que nunca puede quedar desfasado respecto a ellos.
 *
 * @param easting   Coordenada Este del centro de la fuente, en metros.
 * @param northing  Coordenada Norte del centro de la fuente, en metros.
 * @param depth     Profundidad del centro, en metros (positiva hacia abajo).
 * @param dVx       Semieje local X antes de rotar, en metros.
 * @param dVy       Semieje local Y antes de rotar, en metros.
 * @param dVz       Semieje local Z antes de rotar, en metros.
 * @param rotationX Rotación alrededor del eje X, en grados.
 * @param rotationY Rotación alrededor del eje Y, en grados.
 * @param rotationZ Rotación alrededor del eje Z, en grados.
 * @param nu        Coeficiente de Poisson del medio (adimensional).
 */
@Builder
@With
public record EllipsoidSource(
        // --- Posición ---
        int easting,
        int northing,
        int depth,

        // --- Geometría (semiejes) ---
        int dVx,
        int dVy,
        int dVz,

        // --- Orientación ---
        double rotationX,
        double rotationY,
        double rotationZ,

        // --- Medio ---
        double nu
) {

    /**
     * Fuente por defecto: todos los parámetros a cero.
     */
    public static EllipsoidSource defaults() {
        return EllipsoidSource.builder().build();
    }

    /**
     * Volumen del elipsoide en metros cúbicos.
     */
    public double volume() {
        return EllipsoidVolumeCalculator.volume(dVx, dVy, dVz);
    }
}
