package com.netcourier.docqa.service.ingestion;

import java.io.InputStream;

public interface DocumentTextExtractor {

    ExtractedDocument extract(String filename, InputStream inputStream);

    record ExtractedDocument(String title, String contentType, String text) {}
}
