package com.netcourier.docqa.controller;

import com.netcourier.docqa.model.DocumentSummary;
import com.netcourier.docqa.model.IngestResponse;
import com.netcourier.docqa.model.IngestTextRequest;
import com.netcourier.docqa.service.documents.DocumentService;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.ingestion.IngestDocumentCommand;
import com.netcourier.docqa.service.ingestion.IngestTextCommand;
import com.netcourier.docqa.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final IngestionService ingestionService;
    private final DocumentService documentService;

    public DocumentController(IngestionService ingestionService, DocumentService documentService) {
        this.ingestionService = ingestionService;
        this.documentService = documentService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestResponse> ingest(@Valid @RequestBody IngestTextRequest request, Principal principal) {
        IngestTextCommand command = new IngestTextCommand(principal.getName(), request.title(), request.text(),
                request.chunkSize(), request.overlap());
        return blocking(() -> ingestionService.ingestText(command));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestResponse> upload(@RequestPart("file") FilePart file,
                                       @RequestParam(value = "chunkSize", required = false) Integer chunkSize,
                                       @RequestParam(value = "overlap", required = false) Integer overlap,
                                       Principal principal) {
        String ownerId = principal.getName();
        return DataBufferUtils.join(file.content())
                .map(DocumentController::drain)
                .defaultIfEmpty(new byte[0])
                .flatMap(bytes -> {
                    if (bytes.length == 0) {
                        return Mono.error(new InvalidParametersException("File payload is required"));
                    }
                    IngestDocumentCommand command = new IngestDocumentCommand(ownerId, file.filename(), bytes, chunkSize, overlap);
                    return blocking(() -> ingestionService.ingestDocument(command));
                });
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<DocumentSummary>> list(Principal principal) {
        return blocking(() -> documentService.list(principal.getName()));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<DocumentSummary> get(@PathVariable("id") long id, Principal principal) {
        return blocking(() -> documentService.get(principal.getName(), id));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable("id") long id, Principal principal) {
        return blocking(() -> {
            documentService.delete(principal.getName(), id);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @PostMapping(value = "/reindex", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Integer>> reindex(Principal principal) {
        return blocking(() -> Map.of("reindexed", documentService.reindex(principal.getName())));
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
