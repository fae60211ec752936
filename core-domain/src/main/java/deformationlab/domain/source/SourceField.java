package deformationlab.domain.source;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Esquema de campos de una {@link EllipsoidSource}.
 * <p>
 * Los nombres ({@link #wireName()}) y las unidades forman el contrato de interoperabilidad con
 * la aplicación propietaria y con el formulario: no deben cambiarse.
 */
public enum SourceField {

    EASTING("easting", "m", FieldConstraint.integral(-10_000_000, 10_000_000, 100),
            EllipsoidSource::easting, (s, v) -> s.withEasting((int) v)),
    NORTHING("northing", "m", FieldConstraint.integral(-10_000_000, 10_000_000, 100),
            EllipsoidSource::northing, (s, v) -> s.withNorthing((int) v)),
    DEPTH("depth", "m", FieldConstraint.integral(0, 10_000_000, 100),
            EllipsoidSource::depth, (s, v) -> s.withDepth((int) v)),

    DV_X("dVx", "m", FieldConstraint.integral(0, 10_000_000, 25),
            EllipsoidSource::dVx, (s, v) -> s.withDVx((int) v)),
    DV_Y("dVy", "m", FieldConstraint.integral(0, 10_000_000, 25),
            EllipsoidSource::dVy, (s, v) -> s.withDVy((int) v)),
    DV_Z("dVz", "m", FieldConstraint.integral(0, 10_000_000, 25),
            EllipsoidSource::dVz, (s, v) -> s.withDVz((int) v)),

    ROTATION_X("rotation_x", "deg", FieldConstraint.floating(0, 360, 1.0),
            EllipsoidSource::rotationX, EllipsoidSource::withRotationX),
    ROTATION_Y("rotation_y", "deg", FieldConstraint.floating(0, 360, 1.0),
            EllipsoidSource::rotationY, EllipsoidSource::withRotationY),
    ROTATION_Z("rotation_z", "deg", FieldConstraint.floating(0, 360, 1.0),
            EllipsoidSource::rotationZ, EllipsoidSource::withRotationZ),

    // Límite superior heredado tal cual de los controles de rotación; el rango físico es [0, 0.5].
    NU("nu", "", FieldConstraint.floating(0, 360, 0.1),
            EllipsoidSource::nu, EllipsoidSource::withNu),

    // Derivado, de sólo lectura
    VOLUME("volume", "m^3", null, EllipsoidSource::volume, null);

    /**
     * Campos cuya edición obliga a recalcular el volumen.
     */
    public static final Set<SourceField> SEMI_AXES = EnumSet.of(DV_X, DV_Y, DV_Z);

    private static final Map<String, SourceField> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(SourceField::wireName, Function.identity()));

    private final String wireName;
    private final String unit;
    private final FieldConstraint constraint;
    private final Function<EllipsoidSource, Number> reader;
    private final FieldWriter writer;

    SourceField(String wireName, String unit, FieldConstraint constraint,
                Function<EllipsoidSource, Number> reader, FieldWriter writer) {
        this.wireName = wireName;
        this.unit = unit;
        this.constraint = constraint;
        this.reader = reader;
        this.writer = writer;
    }

    /**
     * Busca un campo por su nombre de contrato ({@code "easting"}, {@code "rotation_x"}, ...).
     *
     * @throws IllegalArgumentException si el nombre no pertenece al esquema.
     */
    public static SourceField fromName(String wireName) {
        SourceField field = BY_WIRE_NAME.get(wireName);
        if (field == null) {
            throw new IllegalArgumentException("Campo desconocido: '" + wireName + "'");
        }
        return field;
    }

    public String wireName() {
        return wireName;
    }

    public String unit() {
        return unit;
    }

    public boolean isReadOnly() {
        return writer == null;
    }

    public boolean isIntegral() {
        return constraint != null && constraint.integral();
    }

    public boolean affectsVolume() {
        return SEMI_AXES.contains(this);
    }

    /**
     * @throws IllegalArgumentException si el campo es derivado y no tiene dominio editable.
     */
    public FieldConstraint constraint() {
        if (constraint == null) {
            throw new IllegalArgumentException("El campo '" + wireName + "' es de sólo lectura");
        }
        return constraint;
    }

    public double read(EllipsoidSource source) {
        return reader.apply(source).doubleValue();
    }

    /**
     * Escribe un valor ya normalizado. No valida el dominio: eso es responsabilidad de
     * {@link SourceParameterModel}.
     */
    EllipsoidSource write(EllipsoidSource source, double normalizedValue) {
        if (writer == null) {
            throw new IllegalArgumentException("El campo '" + wireName + "' es de sólo lectura");
        }
        return writer.write(source, normalizedValue);
    }

    @FunctionalInterface
    private interface FieldWriter {
        EllipsoidSource write(EllipsoidSource source, double value);
    }
}
