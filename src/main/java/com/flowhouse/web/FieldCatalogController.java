package com.flowhouse.web;

import com.flowhouse.domain.FieldGroup;
import com.flowhouse.schema.FieldCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Field groups for building the query form
 */
@RestController
@RequestMapping("/api/fields")
public class FieldCatalogController {

    private final FieldCatalogService fieldCatalogService;

    public FieldCatalogController(FieldCatalogService fieldCatalogService) {
        this.fieldCatalogService = fieldCatalogService;
    }

    @GetMapping
    public List<FieldGroup> listFieldGroups() {
        return fieldCatalogService.getFieldGroups();
    }
}
