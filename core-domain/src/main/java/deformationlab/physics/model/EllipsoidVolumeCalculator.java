package deformationlab.physics.model;

/**
 * Volumen de un elipsoide triaxial a partir de sus tres semiejes.
 * <p>
 * V = (4/3) · π · a · b · c
 * <p>
 * Los semiejes se expresan en metros, el volumen en metros cúbicos. La rotación del
 * elipsoide no afecta al volumen.
 */
public final class EllipsoidVolumeCalculator {

    private static final double FOUR_THIRDS_PI = 4.0 / 3.0 * Math.PI;

    private EllipsoidVolumeCalculator() {
    }

    public static double volume(double semiAxisX, double semiAxisY, double semiAxisZ) {
        return FOUR_THIRDS_PI * semiAxisX * semiAxisY * semiAxisZ;
    }
}
