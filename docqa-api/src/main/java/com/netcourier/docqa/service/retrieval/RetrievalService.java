package com.netcourier.docqa.service.retrieval;

public interface RetrievalService {

    ContextBundle retrieve(String ownerId, String question, RetrievalOptions options);
}
