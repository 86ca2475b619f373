package com.flowhouse.web;

import com.flowhouse.domain.DictionaryBinding;
import com.flowhouse.schema.FieldName;
import com.flowhouse.schema.SchemaCatalog;
import com.flowhouse.storage.DictionaryRepository;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dictionary value lookup for filter inputs
 * GET /dict_values/src_asn__name returns the sorted distinct names in the dictionary bound to src_asn
 */
@RestController
public class DictionaryController {
    private static final Logger log = LoggerFactory.getLogger(DictionaryController.class);

    private static final Splitter FIELD_SPLITTER = Splitter.on(FieldName.DICTIONARY_SEPARATOR);

    private final SchemaCatalog catalog;
    private final DictionaryRepository dictionaryRepository;

    public DictionaryController(SchemaCatalog catalog, DictionaryRepository dictionaryRepository) {
        this.catalog = catalog;
        this.dictionaryRepository = dictionaryRepository;
    }

    @GetMapping("/dict_values/{name}")
    public ResponseEntity<List<String>> dictionaryValues(@PathVariable String name) {
        List<String> parts = FIELD_SPLITTER.splitToList(name);
        if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            log.warn("Malformed dictionary value request: {}", name);
            return ResponseEntity.badRequest().build();
        }

        String field = parts.get(0);
        String column = parts.get(1);
        Optional<DictionaryBinding> binding = catalog.findBinding(field);
        if (binding.isEmpty()) {
            log.warn("No dictionary bound to field {}", field);
            return ResponseEntity.badRequest().build();
        }

        List<String> values;
        try {
            values = dictionaryRepository.dictionaryValues(binding.get().getDictionary(), column);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected dictionary value request {}: {}", name, e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        List<String> result = values.stream()
            .filter(v -> v != null && !v.isEmpty())
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        return ResponseEntity.ok(result);
    }
}
