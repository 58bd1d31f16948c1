package com.netcourier.docqa.service.ingestion;

import com.netcourier.docqa.service.error.InvalidParametersException;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractedDocument extract(String filename, InputStream inputStream) {
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        try {
            parser.parse(inputStream, handler, metadata, new ParseContext());
        } catch (TikaException | SAXException e) {
            log.warn("Unable to extract text from {}: {}", filename, e.getMessage());
            throw new InvalidParametersException("Unsupported or corrupt document: " + filename, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded document " + filename, e);
        }
        String title = Optional.ofNullable(metadata.get(TikaCoreProperties.TITLE))
                .filter(value -> !value.isBlank())
                .orElseGet(() -> defaultTitle(filename));
        return new ExtractedDocument(title, metadata.get(Metadata.CONTENT_TYPE), handler.toString().trim());
    }

    private String defaultTitle(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Document";
        }
        String baseName = FilenameUtils.getBaseName(filename);
        return baseName.isBlank() ? "Document" : baseName;
    }
}
