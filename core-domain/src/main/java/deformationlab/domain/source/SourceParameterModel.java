package deformationlab.domain.source;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Fuente única de verdad de una sesión de edición.
 * <p>
 * Mantiene dos copias de los parámetros:
 * <ul>
 * <li>{@code committed}: el último estado aceptado y publicado a la aplicación propietaria.</li>
 * <li>{@code pending}: el búfer de edición en curso.</li>
 * </ul>
 * Ambas son idénticas tras la construcción, tras {@link #commit()} y tras {@link #discard()}.
 * Cada escritura pasa por el {@link FieldConstraint} del campo, por lo que {@code pending}
 * siempre está dentro de dominio.
 * <p>
 * No es thread-safe: cada sesión de edición posee su propia instancia.
 */
@Slf4j
public class SourceParameterModel {

    /**
     * Límite físico del coeficiente de Poisson. El dominio editable es más amplio.
     */
    private static final double PHYSICAL_NU_LIMIT = 0.5;

    private final EllipsoidSource defaults;
    private EllipsoidSource committed;
    private EllipsoidSource pending;

    public SourceParameterModel() {
        this(EllipsoidSource.defaults());
    }

    public SourceParameterModel(EllipsoidSource initial) {
        this(initial, EllipsoidSource.defaults());
    }

    /**
     * @param initial  Parámetros de la fuente existente (o los valores por defecto).
     * @param defaults Valores a los que vuelve {@link #resetToDefaults()}.
     */
    public SourceParameterModel(EllipsoidSource initial, EllipsoidSource defaults) {
        Objects.requireNonNull(initial, "initial");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        // Un registro externo podría venir fuera de dominio: se normaliza campo a campo.
        this.committed = normalizeAll(initial);
        this.pending = this.committed;
    }

    /**
     * Escribe un valor tecleado en el búfer de edición.
     *
     * @param fieldName Nombre de contrato del campo.
     * @param value     Valor bruto.
     * @return El valor efectivamente almacenado tras normalizar.
     */
    public double setField(String fieldName, double value) {
        return setField(SourceField.fromName(fieldName), value);
    }

    public double setField(SourceField field, double value) {
        double normalized = field.constraint().normalizeEntry(value);
        store(field, value, normalized);
        return normalized;
    }

    /**
     * Incrementa (o decrementa, con {@code steps} negativo) un campo en pasos enteros.
     *
     * @return El valor almacenado tras normalizar.
     */
    public double stepField(String fieldName, int steps) {
        return stepField(SourceField.fromName(fieldName), steps);
    }

    public double stepField(SourceField field, int steps) {
        double current = field.read(pending);
        double normalized = field.constraint().stepBy(current, steps);
        store(field, current + steps * field.constraint().step(), normalized);
        return normalized;
    }

    /**
     * Copia de sólo lectura del búfer de edición.
     */
    public EllipsoidSource snapshotPending() {
        return pending;
    }

    public EllipsoidSource getCommitted() {
        return committed;
    }

    /**
     * Indica si hay ediciones sin aplicar.
     */
    public boolean hasPendingChanges() {
        return !pending.equals(committed);
    }

    /**
     * Acepta el búfer de edición como nuevo estado confirmado.
     *
     * @return El nuevo estado confirmado.
     */
    public EllipsoidSource commit() {
        committed = pending;
        log.debug("Parámetros confirmados: {}", committed);
        return committed;
    }

    /**
     * Descarta las ediciones no aplicadas.
     */
    public void discard() {
        if (hasPendingChanges()) {
            log.debug("Descartando ediciones pendientes: {}", pending);
        }
        pending = committed;
    }

    /**
     * Carga los valores por defecto en el búfer de edición. El estado confirmado no cambia.
     */
    public void resetToDefaults() {
        pending = normalizeAll(defaults);
    }

    private void store(SourceField field, double raw, double normalized) {
        pending = field.write(pending, normalized);

        if (raw != normalized) {
            log.debug("{} = {} normalizado a {}", field.wireName(), raw, normalized);
        } else {
            log.debug("{} = {}", field.wireName(), normalized);
        }
        if (field == SourceField.NU && normalized > PHYSICAL_NU_LIMIT) {
            log.warn("Coeficiente de Poisson {} fuera del rango físico [0, {}]", normalized, PHYSICAL_NU_LIMIT);
        }
    }

    private static EllipsoidSource normalizeAll(EllipsoidSource source) {
        EllipsoidSource result = source;
        for (SourceField field : SourceField.values()) {
            if (field.isReadOnly()) continue;
            double value = field.read(source);
            double normalized = field.constraint().normalizeEntry(value);
            if (normalized != value) {
                log.warn("Valor inicial fuera de dominio: {} = {} normalizado a {}", field.wireName(), value, normalized);
                result = field.write(result, normalized);
            }
        }
        return result;
    }
}
