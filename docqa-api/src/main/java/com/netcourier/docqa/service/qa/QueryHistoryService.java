package com.netcourier.docqa.service.qa;

import com.netcourier.docqa.model.QueryHistoryEntry;
import com.netcourier.docqa.persistence.entity.DeliveryMode;
import com.netcourier.docqa.persistence.entity.QueryLogEntity;
import com.netcourier.docqa.persistence.repository.QueryLogRepository;
import com.netcourier.docqa.service.error.InvalidParametersException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Query log access shared by whole-answer and streamed questions.
 */
@Service
public class QueryHistoryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final QueryLogRepository queryLogRepository;

    public QueryHistoryService(QueryLogRepository queryLogRepository) {
        this.queryLogRepository = queryLogRepository;
    }

    public void record(String ownerId,
                       String question,
                       String answer,
                       long elapsedMillis,
                       List<String> chunkIds,
                       String backend,
                       DeliveryMode mode) {
        queryLogRepository.save(new QueryLogEntity(ownerId, question, answer, elapsedMillis, chunkIds, backend, mode));
    }

    public List<QueryHistoryEntry> recent(String ownerId, Integer limit) {
        int size = limit == null ? DEFAULT_LIMIT : limit;
        if (size < 1 || size > MAX_LIMIT) {
            throw new InvalidParametersException("limit must be between 1 and " + MAX_LIMIT);
        }
        return queryLogRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId, PageRequest.of(0, size)).stream()
                .map(log -> new QueryHistoryEntry(log.getId(), log.getQuestion(), log.getAnswer(), log.getElapsedMillis(),
                        log.getChunksUsed(), log.getChunkIds(), log.getBackend(),
                        log.getMode().name().toLowerCase(Locale.ROOT), log.getCreatedAt()))
                .toList();
    }
}
