package com.netcourier.docqa.controller;

import com.netcourier.docqa.model.AnswerResponse;
import com.netcourier.docqa.model.AskRequest;
import com.netcourier.docqa.model.BackendsResponse;
import com.netcourier.docqa.model.QueryHistoryEntry;
import com.netcourier.docqa.model.StreamEvent;
import com.netcourier.docqa.service.qa.QueryHistoryService;
import com.netcourier.docqa.service.qa.QuestionAnsweringService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

import static com.netcourier.docqa.controller.DocumentController.blocking;

@RestController
@RequestMapping("/api/qa")
public class QaController {

    private final QuestionAnsweringService questionAnsweringService;
    private final QueryHistoryService queryHistoryService;

    public QaController(QuestionAnsweringService questionAnsweringService, QueryHistoryService queryHistoryService) {
        this.questionAnsweringService = questionAnsweringService;
        this.queryHistoryService = queryHistoryService;
    }

    @PostMapping(value = "/ask", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AnswerResponse> ask(@Valid @RequestBody AskRequest request, Principal principal) {
        return blocking(() -> questionAnsweringService.ask(principal.getName(), request));
    }

    /**
     * Quota and argument errors surface as a plain HTTP error before the stream opens. Closing the connection
     * cancels the session.
     */
    @PostMapping(value = "/ask/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<StreamEvent>>>> askStream(@Valid @RequestBody AskRequest request,
                                                                             Principal principal) {
        return blocking(() -> questionAnsweringService.openSession(principal.getName(), request))
                .map(session -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_EVENT_STREAM)
                        .body(session.events().map(QaController::toServerSentEvent)));
    }

    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<QueryHistoryEntry>> history(@RequestParam(value = "limit", required = false) Integer limit,
                                                 Principal principal) {
        return blocking(() -> queryHistoryService.recent(principal.getName(), limit));
    }

    @GetMapping(value = "/backends", produces = MediaType.APPLICATION_JSON_VALUE)
    public BackendsResponse backends() {
        return questionAnsweringService.backends();
    }

    private static ServerSentEvent<StreamEvent> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.builder(event)
                .event(event.type().eventName())
                .build();
    }
}
