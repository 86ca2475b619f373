package com.flowhouse.query;

import com.flowhouse.domain.FieldDescriptor;
import com.flowhouse.schema.FieldName;
import com.flowhouse.schema.SchemaCatalog;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Turns result column aliases into the short labels used in series keys,
 * e.g. {@code src_asn} to {@code Src.AS} and {@code src_asn__name} to {@code Src.AS.Name}.
 */
@Component
public class ColumnLabeler {

    private final SchemaCatalog catalog;

    public ColumnLabeler(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    public String label(String alias) {
        Optional<FieldDescriptor> exact = catalog.findField(alias);
        if (exact.isPresent()) {
            return exact.get().getShortLabel();
        }

        String label = alias;
        for (FieldDescriptor field : catalog.getFields()) {
            if (label.startsWith(field.getName())) {
                label = field.getShortLabel() + label.substring(field.getName().length());
                break;
            }
        }

        int idx = label.indexOf(FieldName.DICTIONARY_SEPARATOR);
        if (idx < 0) {
            return label;
        }

        String attribute = label.substring(idx + FieldName.DICTIONARY_SEPARATOR.length());
        return label.substring(0, idx) + "." + StringUtils.capitalize(attribute);
    }
}
