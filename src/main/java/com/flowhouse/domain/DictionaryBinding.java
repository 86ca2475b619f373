package com.flowhouse.domain;

import com.google.common.collect.ImmutableList;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Connects a flow field with a ClickHouse dictionary.
 *
 * The key expression template is a format string with one {@code %s} slot per key
 * argument. When no key columns are configured the bound field itself is the only
 * key argument, e.g. field {@code src_asn} with template {@code toUInt64(%s)}.
 * Composite dictionary keys list their columns explicitly, e.g. keys
 * {@code [agent, int_in]} with template {@code tuple(IPv6NumToString(%s), %s)}.
 *
 * Field, key columns and dictionary name end up in SQL text, so they are checked
 * to be identifiers on construction.
 */
public class DictionaryBinding {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DICTIONARY_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final Pattern KEY_SLOT = Pattern.compile("%s");

    private final String field;
    private final String dictionary;
    private final String keyExpressionTemplate;
    private final List<String> keyColumns;

    public DictionaryBinding(String field, String dictionary, String keyExpressionTemplate, List<String> keyColumns) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary must not be null");
        this.keyExpressionTemplate = keyExpressionTemplate == null || keyExpressionTemplate.isBlank()
            ? "%s"
            : keyExpressionTemplate;
        this.keyColumns = keyColumns == null ? ImmutableList.of() : ImmutableList.copyOf(keyColumns);

        if (!IDENTIFIER.matcher(field).matches()) {
            throw new IllegalArgumentException("Invalid field in dictionary binding: " + field);
        }
        if (!isDictionaryName(dictionary)) {
            throw new IllegalArgumentException("Invalid dictionary name for field " + field + ": " + dictionary);
        }
        for (String key : this.keyColumns) {
            if (key == null || !IDENTIFIER.matcher(key).matches()) {
                throw new IllegalArgumentException("Invalid key column for field " + field + ": " + key);
            }
        }

        int slots = 0;
        Matcher slot = KEY_SLOT.matcher(this.keyExpressionTemplate);
        while (slot.find()) {
            slots++;
        }
        int arguments = this.keyColumns.isEmpty() ? 1 : this.keyColumns.size();
        if (slots != arguments) {
            throw new IllegalArgumentException(String.format(
                "Key expression %s for field %s has %d slot(s) but %d key argument(s)",
                this.keyExpressionTemplate, field, slots, arguments));
        }
        try {
            renderKeyExpression();
        } catch (IllegalFormatException e) {
            throw new IllegalArgumentException("Invalid key expression for field " + field + ": "
                + this.keyExpressionTemplate, e);
        }
    }

    /**
     * Whether a name is a dictionary name, optionally qualified with its database
     */
    public static boolean isDictionaryName(String name) {
        return name != null && DICTIONARY_NAME.matcher(name).matches();
    }

    public String getField() {
        return field;
    }

    public String getDictionary() {
        return dictionary;
    }

    public String getKeyExpressionTemplate() {
        return keyExpressionTemplate;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    /**
     * Number of leading dictionary columns that make up the key.
     */
    public int getKeyLength() {
        return keyColumns.isEmpty() ? 1 : keyColumns.size();
    }

    /**
     * Render the lookup key expression by filling the template with the key columns,
     * or with the bound field when no key columns are configured.
     */
    public String renderKeyExpression() {
        Object[] args = keyColumns.isEmpty()
            ? new Object[] {field}
            : keyColumns.toArray();
        return String.format(Locale.ROOT, keyExpressionTemplate, args);
    }

    @Override
    public String toString() {
        return "DictionaryBinding{field='" + field + "', dictionary='" + dictionary
            + "', expr='" + keyExpressionTemplate + "', keys=" + keyColumns + "}";
    }
}
