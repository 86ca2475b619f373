package com.flowhouse.web;

import com.flowhouse.domain.DictionaryBinding;
import com.flowhouse.domain.FieldGroup;
import com.flowhouse.schema.FieldCatalogService;
import com.flowhouse.schema.SchemaCatalog;
import com.flowhouse.storage.DictionaryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DictionaryController and FieldCatalogController
 */
@ExtendWith(MockitoExtension.class)
class DictionaryControllerTest {

    @Mock
    private DictionaryRepository dictionaryRepository;

    @Mock
    private FieldCatalogService fieldCatalogService;

    private DictionaryController controller;

    @BeforeEach
    void setUp() {
        SchemaCatalog catalog = SchemaCatalog.forFlows(List.of(
            new DictionaryBinding("src_asn", "asn_names", "toUInt64(%s)", List.of())));
        controller = new DictionaryController(catalog, dictionaryRepository);
    }

    @Test
    void testDictionaryValues_DistinctSortedNonEmpty() {
        when(dictionaryRepository.dictionaryValues("asn_names", "name"))
            .thenReturn(Arrays.asList("OTHER-AS", "", "EXAMPLE-AS", null, "OTHER-AS"));

        ResponseEntity<List<String>> response = controller.dictionaryValues("src_asn__name");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsExactly("EXAMPLE-AS", "OTHER-AS");
    }

    @Test
    void testDictionaryValues_MalformedNameIsBadRequest() {
        assertThat(controller.dictionaryValues("src_asn").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.dictionaryValues("src_asn__").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.dictionaryValues("src_asn__name__x").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(dictionaryRepository);
    }

    @Test
    void testDictionaryValues_UnboundFieldIsBadRequest() {
        ResponseEntity<List<String>> response = controller.dictionaryValues("dst_port__service");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(dictionaryRepository);
    }

    @Test
    void testDictionaryValues_UnknownColumnIsBadRequest() {
        when(dictionaryRepository.dictionaryValues("asn_names", "owner"))
            .thenThrow(new IllegalArgumentException("Dictionary asn_names has no column owner"));

        assertThat(controller.dictionaryValues("src_asn__owner").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void testDictionaryValues_StorageFailurePropagates() {
        when(dictionaryRepository.dictionaryValues("asn_names", "name"))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        assertThatThrownBy(() -> controller.dictionaryValues("src_asn__name"))
            .isInstanceOf(DataAccessResourceFailureException.class);

        ResponseEntity<Void> response = new RestExceptionHandler()
            .handleDataAccess(new DataAccessResourceFailureException("Connection refused"));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void testListFieldGroups() {
        FieldGroup group = new FieldGroup("src_asn", "Source ASN");
        group.addOption("src_asn", "Source ASN");
        group.addOption("src_asn__name", "Source ASN Name");
        when(fieldCatalogService.getFieldGroups()).thenReturn(List.of(group));

        List<FieldGroup> groups = new FieldCatalogController(fieldCatalogService).listFieldGroups();

        assertThat(groups).containsExactly(group);
        assertThat(groups.get(0).getFields()).extracting(FieldGroup.Option::getName)
            .containsExactly("src_asn", "src_asn__name");
    }
}
