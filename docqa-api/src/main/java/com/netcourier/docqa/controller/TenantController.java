package com.netcourier.docqa.controller;

import com.netcourier.docqa.service.documents.DocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.Map;

/**
 * Account deletion: removes everything stored for the calling owner.
 */
@RestController
@RequestMapping("/api/tenant")
public class TenantController {

    private static final Logger log = LoggerFactory.getLogger(TenantController.class);

    private final DocumentService documentService;

    public TenantController(DocumentService documentService) {
        this.documentService = documentService;
    }

    @DeleteMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Integer>> wipe(Principal principal) {
        String ownerId = principal.getName();
        return DocumentController.blocking(() -> documentService.wipe(ownerId))
                .doOnNext(removed -> log.info("Wiped tenant {} ({} documents)", ownerId, removed))
                .map(removed -> Map.of("documentsRemoved", removed));
    }
}
