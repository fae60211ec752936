package deformationlab.domain.source;

/**
 * Dominio numérico de un campo editable: límites, paso, tipo (entero o real) y política de
 * desbordamiento.
 * <p>
 * Todas las operaciones son funciones puras. Cualquier valor finito se transforma en
 * exactamente un valor dentro de {@code [min, max]}:
 * <ul>
 * <li>Campos enteros: aritmética cíclica módulo {@code max - min + step}. Un paso por encima de
 * {@code max} vuelve a {@code min} y un paso por debajo de {@code min} vuelve a {@code max}.
 * Todo resultado desbordado o desplazado por pasos se ajusta a la rejilla {@code min + k·step};
 * un valor tecleado dentro de rango sólo se redondea al entero más cercano.</li>
 * <li>Campos reales: aritmética cíclica módulo {@code max - min} (un círculo completo). A diferencia
 * de los enteros, el ciclo no incluye el paso: 360° equivale a 0° y 370° a 10°, no a 9°. Los
 * valores dentro del rango se aceptan tal cual, incluido {@code max}.</li>
 * </ul>
 * Si {@code wraps} es falso el valor se satura en el límite más cercano (comportamiento clásico
 * de un spinner).
 *
 * @param min      Límite inferior (inclusivo).
 * @param max      Límite superior (inclusivo).
 * @param step     Incremento de un paso del control (flechas, rueda del ratón).
 * @param integral Si el campo sólo admite enteros.
 * @param wraps    Si el desbordamiento da la vuelta al rango en lugar de saturar.
 */
public record FieldConstraint(double min, double max, double step, boolean integral, boolean wraps) {

    public FieldConstraint {
        if (!(min < max)) {
            throw new IllegalArgumentException("El rango es vacío: [" + min + ", " + max + "]");
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("El paso debe ser positivo: " + step);
        }
    }

    public static FieldConstraint integral(long min, long max, long step) {
        return new FieldConstraint(min, max, step, true, true);
    }

    public static FieldConstraint floating(double min, double max, double step) {
        return new FieldConstraint(min, max, step, false, true);
    }

    /**
     * Aplica un incremento (positivo o negativo) al valor actual y devuelve el resultado
     * dentro del dominio.
     *
     * @param currentValue   Valor actual del campo.
     * @param requestedDelta Incremento solicitado por el formulario.
     * @return Nuevo valor normalizado.
     */
    public double normalize(double currentValue, double requestedDelta) {
        requireFinite(currentValue);
        requireFinite(requestedDelta);
        double result = normalizeEntry(currentValue + requestedDelta);
        if (integral && requestedDelta != 0) {
            return snapToStep(result);
        }
        return result;
    }

    /**
     * Incremento en pasos enteros (una pulsación de flecha = 1, una hacia abajo = -1).
     */
    public double stepBy(double currentValue, int steps) {
        return normalize(currentValue, steps * step);
    }

    /**
     * Normaliza un valor introducido directamente (tecleado).
     *
     * @param value Valor bruto.
     * @return El mismo valor si está en rango, o su imagen cíclica en caso contrario.
     */
    public double normalizeEntry(double value) {
        requireFinite(value);
        // Redondeo half-up sin pasar por long: la entrada puede exceder su rango
        double candidate = integral ? Math.floor(value + 0.5) : value;

        if (contains(candidate)) {
            return candidate;
        }
        if (!wraps) {
            return Math.max(min, Math.min(max, candidate));
        }
        return integral ? snapToStep(candidate) : wrapContinuous(candidate);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /**
     * Ancho del ciclo de desbordamiento.
     */
    public double domainWidth() {
        return integral ? (max - min + step) : (max - min);
    }

    /**
     * Lleva el valor a la rejilla {@code min + k·step} dentro del ciclo. Si el redondeo alcanza
     * {@code max + step} (la ranura siguiente a {@code max}) el resultado es {@code min}.
     */
    private double snapToStep(double value) {
        if (!wraps) {
            double aligned = min + Math.round((value - min) / step) * step;
            return Math.max(min, Math.min(max, aligned));
        }
        double width = domainWidth();
        double offset = floorMod(value - min, width);
        double aligned = Math.round(offset / step) * step;
        if (aligned > max - min) {
            return min;
        }
        return min + aligned;
    }

    private double wrapContinuous(double value) {
        return min + floorMod(value - min, domainWidth());
    }

    private static double floorMod(double value, double width) {
        double offset = value % width;
        return offset < 0 ? offset + width : offset;
    }

    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Valor numérico no finito: " + value);
        }
    }
}
