package com.flowhouse.schema;

import com.flowhouse.domain.DictionaryBinding;
import com.flowhouse.domain.FieldDescriptor;
import com.flowhouse.domain.FieldGroup;
import com.flowhouse.storage.DictionaryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the fields a query form can offer.
 *
 * Every catalog field becomes a group holding the field itself, followed by one
 * option per non-key attribute of each dictionary bound to it, e.g. group
 * {@code src_asn} with options {@code src_asn} and {@code src_asn__name}.
 */
@Service
public class FieldCatalogService {

    private static final Logger log = LoggerFactory.getLogger(FieldCatalogService.class);

    private final SchemaCatalog catalog;
    private final DictionaryRepository dictionaryRepository;

    public FieldCatalogService(SchemaCatalog catalog, DictionaryRepository dictionaryRepository) {
        this.catalog = catalog;
        this.dictionaryRepository = dictionaryRepository;
    }

    public List<FieldGroup> getFieldGroups() {
        List<FieldGroup> groups = new ArrayList<>();

        for (FieldDescriptor field : catalog.getFields()) {
            FieldGroup group = new FieldGroup(field.getName(), field.getLabel());
            group.addOption(field.getName(), field.getLabel());

            for (DictionaryBinding binding : catalog.getBindings()) {
                if (!binding.getField().equals(field.getName())) {
                    continue;
                }

                List<String> columns;
                try {
                    columns = dictionaryRepository.describeDictionary(binding.getDictionary());
                } catch (RuntimeException e) {
                    log.warn("Unable to describe dictionary {} for field {}: {}",
                        binding.getDictionary(), field.getName(), e.getMessage());
                    continue;
                }

                for (int i = binding.getKeyLength(); i < columns.size(); i++) {
                    String column = columns.get(i);
                    group.addOption(
                        field.getName() + FieldName.DICTIONARY_SEPARATOR + column,
                        field.getLabel() + " " + StringUtils.capitalize(column));
                }
            }

            groups.add(group);
        }

        return groups;
    }
}
