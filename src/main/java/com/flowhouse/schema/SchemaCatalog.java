package com.flowhouse.schema;

import com.flowhouse.domain.DictionaryBinding;
import com.flowhouse.domain.FieldDescriptor;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of everything a flow query may reference.
 *
 * The catalog holds:
 * - The queryable field descriptors, in display order
 * - The raw columns of the {@code flows} table
 * - Virtual fields, which have no backing column and resolve to a fixed expression
 * - Dictionary bindings, at most one per field
 *
 * A catalog is built once at startup and shared between requests without locking.
 * Field and column names in here are the only identifiers ever interpolated into SQL.
 */
public final class SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    public static final String FLOWS_TABLE = "flows";
    public static final String TIMESTAMP_COLUMN = "timestamp";

    /**
     * Raw columns of the flows table, in table order.
     */
    public static final List<String> FLOW_COLUMNS = ImmutableList.of(
        "agent", "int_in", "int_out",
        "src_ip_addr", "dst_ip_addr",
        "src_ip_pfx_addr", "src_ip_pfx_len",
        "dst_ip_pfx_addr", "dst_ip_pfx_len",
        "src_asn", "dst_asn",
        "ip_protocol", "src_port", "dst_port",
        TIMESTAMP_COLUMN, "size", "packets", "samplerate");

    private static final List<FieldDescriptor> FLOW_FIELDS = ImmutableList.of(
        new FieldDescriptor("agent", "Agent", "A."),
        new FieldDescriptor("int_in", "Interface In", "Int.In"),
        new FieldDescriptor("int_out", "Interface Out", "Int.Out"),
        new FieldDescriptor("src_ip_addr", "Source IP", "Src.IP"),
        new FieldDescriptor("src_ip_pfx", "Source IP Prefix", "Src.IP.Pfx"),
        new FieldDescriptor("dst_ip_addr", "Destination IP", "Dst.IP"),
        new FieldDescriptor("dst_ip_pfx", "Destination IP Prefix", "Dst.IP.Pfx"),
        new FieldDescriptor("src_asn", "Source ASN", "Src.AS"),
        new FieldDescriptor("dst_asn", "Destination ASN", "Dst.AS"),
        new FieldDescriptor("ip_protocol", "IP Protocol", "IP.Proto"),
        new FieldDescriptor("src_port", "Source Port", "Src.Port"),
        new FieldDescriptor("dst_port", "Destination Port", "Dst.Port"));

    private static final Map<String, String> FLOW_VIRTUAL_FIELDS = ImmutableMap.of(
        "src_ip_pfx", cidrExpression("src_ip_pfx"),
        "dst_ip_pfx", cidrExpression("dst_ip_pfx"));

    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> fieldsByName;
    private final Set<String> columns;
    private final Map<String, String> virtualFields;
    private final List<DictionaryBinding> bindings;
    private final Map<String, DictionaryBinding> bindingsByField;

    public SchemaCatalog(
            List<FieldDescriptor> fields,
            List<String> columns,
            Map<String, String> virtualFields,
            List<DictionaryBinding> bindings) {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            if (byName.putIfAbsent(field.getName(), field) != null) {
                throw new IllegalArgumentException("Duplicate field descriptor: " + field.getName());
            }
        }

        Map<String, DictionaryBinding> byField = new LinkedHashMap<>();
        for (DictionaryBinding binding : bindings) {
            if (byField.putIfAbsent(binding.getField(), binding) != null) {
                log.warn("Ignoring duplicate dictionary binding for field {}: {}", binding.getField(), binding);
            }
        }

        this.fields = ImmutableList.copyOf(fields);
        this.fieldsByName = ImmutableMap.copyOf(byName);
        this.columns = ImmutableSet.copyOf(columns);
        this.virtualFields = ImmutableMap.copyOf(virtualFields);
        this.bindings = ImmutableList.copyOf(bindings);
        this.bindingsByField = ImmutableMap.copyOf(byField);
    }

    /**
     * Catalog for the flows table with the given dictionary bindings.
     */
    public static SchemaCatalog forFlows(List<DictionaryBinding> bindings) {
        return new SchemaCatalog(FLOW_FIELDS, FLOW_COLUMNS, FLOW_VIRTUAL_FIELDS, bindings);
    }

    private static String cidrExpression(String prefixField) {
        return String.format("concat(IPv6NumToString(%1$s_addr), '/', toString(%1$s_len))", prefixField);
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public Optional<FieldDescriptor> findField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    /**
     * Whether a plain name refers to a known field or a raw table column.
     */
    public boolean isQueryable(String name) {
        return fieldsByName.containsKey(name) || columns.contains(name);
    }

    public Optional<String> findVirtualExpression(String name) {
        return Optional.ofNullable(virtualFields.get(name));
    }

    public Optional<DictionaryBinding> findBinding(String field) {
        return Optional.ofNullable(bindingsByField.get(field));
    }

    /**
     * Bindings in configuration order, duplicates included.
     */
    public List<DictionaryBinding> getBindings() {
        return bindings;
    }
}
