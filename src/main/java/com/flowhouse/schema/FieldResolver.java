package com.flowhouse.schema;

import com.flowhouse.domain.DictionaryBinding;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps logical field names to ClickHouse SQL expressions.
 *
 * Three kinds of names are understood:
 * - Virtual fields, e.g. {@code src_ip_pfx}, rendered from the prefix address and length columns as CIDR text
 * - Plain fields, e.g. {@code src_asn}, which are referenced as-is
 * - Dictionary-qualified fields, e.g. {@code src_asn__name}, rendered as a {@code dictGet} lookup
 *
 * Every identifier placed into an expression comes from the {@link SchemaCatalog}
 * or has been checked to be a plain identifier.
 */
@Component
public class FieldResolver {

    private final SchemaCatalog catalog;

    public FieldResolver(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolve a logical field name to a SQL expression.
     *
     * @param fieldName logical field name as sent by the client
     * @return the SQL expression selecting that field
     * @throws ResolutionException if the name is unknown, malformed, or names a dictionary attribute
     *         of a field without a dictionary binding
     */
    public String resolve(String fieldName) throws ResolutionException {
        if (fieldName == null || fieldName.isEmpty()) {
            throw new ResolutionException(String.valueOf(fieldName), ResolutionException.Reason.INVALID_NAME,
                "Empty field name");
        }

        Optional<String> virtualExpression = catalog.findVirtualExpression(fieldName);
        if (virtualExpression.isPresent()) {
            return virtualExpression.get();
        }

        FieldName name = FieldName.parse(fieldName);
        if (!name.isDictionaryQualified()) {
            if (!FieldName.isIdentifier(fieldName)) {
                throw new ResolutionException(fieldName, ResolutionException.Reason.INVALID_NAME,
                    "Field name is not an identifier");
            }
            if (!catalog.isQueryable(fieldName)) {
                throw new ResolutionException(fieldName, ResolutionException.Reason.UNKNOWN_FIELD,
                    "Unknown flow field");
            }
            return fieldName;
        }

        String attribute = name.getAttribute().get();
        DictionaryBinding binding = catalog.findBinding(name.getBase())
            .orElseThrow(() -> new ResolutionException(fieldName, ResolutionException.Reason.MISSING_DICTIONARY,
                "Dict for field " + name.getBase() + " not found"));

        if (!FieldName.isIdentifier(attribute)) {
            throw new ResolutionException(fieldName, ResolutionException.Reason.INVALID_NAME,
                "Dictionary attribute is not an identifier");
        }

        return String.format("dictGet('%s', '%s', %s)",
            binding.getDictionary(), attribute, binding.renderKeyExpression());
    }
}
