package organ.converter.model;

import java.util.Objects;

/**
 * Typed access to source record attributes declared in {@link SourceAttributes}.
 * <p>
 * A missing required attribute or an unparsable value is appended to the run log and replaced by the
 * declared default; nothing is thrown for data-quality problems.
 */
public final class AttributeReader {

    private final ConversionLog log;

    public AttributeReader(ConversionLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public String text(SourceRecord record, AttrSpec spec) {
        final String raw = raw(record, spec);
        return raw != null ? raw : spec.defaultValue();
    }

    public Integer integer(SourceRecord record, AttrSpec spec) {
        final String raw = raw(record, spec);
        if (raw != null) {
            try {
                return Integer.valueOf(raw.trim());
            } catch (NumberFormatException ex) {
                log.warn(record.key() + ": invalid integer " + spec.name() + "=" + raw);
            }
        }
        return spec.defaultValue() == null ? null : Integer.valueOf(spec.defaultValue());
    }

    public int integer(SourceRecord record, AttrSpec spec, int fallback) {
        final Integer v = integer(record, spec);
        return v == null ? fallback : v;
    }

    public Double decimal(SourceRecord record, AttrSpec spec) {
        final String raw = raw(record, spec);
        if (raw != null) {
            try {
                return Double.valueOf(raw.trim());
            } catch (NumberFormatException ex) {
                log.warn(record.key() + ": invalid number " + spec.name() + "=" + raw);
            }
        }
        return spec.defaultValue() == null ? null : Double.valueOf(spec.defaultValue());
    }

    public boolean flag(SourceRecord record, AttrSpec spec) {
        final String raw = raw(record, spec);
        if (raw != null) {
            final String v = raw.trim();
            if ("Y".equalsIgnoreCase(v)) {
                return true;
            }
            if ("N".equalsIgnoreCase(v)) {
                return false;
            }
            log.warn(record.key() + ": invalid boolean " + spec.name() + "=" + raw);
        }
        return "Y".equals(spec.defaultValue());
    }

    /**
     * Positive integer id held by a reference attribute, or null when unset or invalid.
     */
    public Integer reference(SourceRecord record, AttrSpec spec) {
        final String raw = raw(record, spec);
        if (raw == null) {
            return null;
        }
        final Integer id = Ids.parsePositiveInt(raw);
        if (id == null) {
            log.warn(record.key() + ": invalid reference " + spec.name() + "=" + raw);
        }
        return id;
    }

    public boolean isSet(SourceRecord record, AttrSpec spec) {
        return record != null && record.hasAttr(spec.name());
    }

    private String raw(SourceRecord record, AttrSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (record == null) {
            return null;
        }
        if (!record.type().equals(spec.recordType())) {
            log.internal("attribute " + spec.qualifiedName() + " read on " + record.key());
        }
        final String raw = record.attr(spec.name());
        if (raw == null && spec.required()) {
            log.warn(record.key() + ": missing attribute " + spec.name());
        }
        return raw;
    }
}
