package com.netcourier.docqa.controller;

import com.netcourier.docqa.service.documents.DocumentService;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TenantControllerTest {

    @Test
    void wipeReportsRemovedDocuments() {
        DocumentService documentService = mock(DocumentService.class);
        when(documentService.wipe("alice")).thenReturn(3);

        ControllerTestSupport.clientFor(new TenantController(documentService), "alice")
                .delete().uri("/api/tenant")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.documentsRemoved").isEqualTo(3);
    }
}
