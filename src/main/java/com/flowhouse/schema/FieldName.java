package com.flowhouse.schema;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A logical field name split into its flow field and optional dictionary attribute.
 *
 * {@code src_asn} names the flow field directly, {@code src_asn__name} names the
 * {@code name} attribute of the dictionary bound to {@code src_asn}. Only the first
 * separator splits.
 */
public final class FieldName {

    public static final String DICTIONARY_SEPARATOR = "__";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String base;
    private final String attribute;

    private FieldName(String base, String attribute) {
        this.base = base;
        this.attribute = attribute;
    }

    public static FieldName parse(String name) {
        int idx = name.indexOf(DICTIONARY_SEPARATOR);
        if (idx < 0) {
            return new FieldName(name, null);
        }
        return new FieldName(name.substring(0, idx), name.substring(idx + DICTIONARY_SEPARATOR.length()));
    }

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    public String getBase() {
        return base;
    }

    public Optional<String> getAttribute() {
        return Optional.ofNullable(attribute);
    }

    public boolean isDictionaryQualified() {
        return attribute != null;
    }

    @Override
    public String toString() {
        return attribute == null ? base : base + DICTIONARY_SEPARATOR + attribute;
    }
}
