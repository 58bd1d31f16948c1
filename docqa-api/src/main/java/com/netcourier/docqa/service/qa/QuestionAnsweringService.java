package com.netcourier.docqa.service.qa;

import com.netcourier.docqa.model.AnswerResponse;
import com.netcourier.docqa.model.AskRequest;
import com.netcourier.docqa.model.BackendsResponse;
import com.netcourier.docqa.service.session.StreamingSession;

public interface QuestionAnsweringService {

    AnswerResponse ask(String ownerId, AskRequest request);

    /**
     * Checks the owner's query quota and returns a session that has not started yet.
     */
    StreamingSession openSession(String ownerId, AskRequest request);

    BackendsResponse backends();
}
