package com.netcourier.docqa.service.qa;

import com.netcourier.docqa.config.RagProperties;
import com.netcourier.docqa.persistence.repository.QueryLogRepository;
import com.netcourier.docqa.service.error.QuotaExceededException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Rolling one-hour question limit per owner, counted from the query log.
 */
@Component
public class QueryQuotaGuard {

    private final QueryLogRepository queryLogRepository;
    private final int maxQueriesPerHour;
    private final Clock clock;

    @Autowired
    public QueryQuotaGuard(QueryLogRepository queryLogRepository, RagProperties properties) {
        this(queryLogRepository, properties.getLimits().getMaxQueriesPerHour(), Clock.systemUTC());
    }

    QueryQuotaGuard(QueryLogRepository queryLogRepository, int maxQueriesPerHour, Clock clock) {
        this.queryLogRepository = queryLogRepository;
        this.maxQueriesPerHour = maxQueriesPerHour;
        this.clock = clock;
    }

    public void check(String ownerId) {
        OffsetDateTime since = OffsetDateTime.now(clock).minusHours(1);
        if (queryLogRepository.countByOwnerIdAndCreatedAtAfter(ownerId, since) >= maxQueriesPerHour) {
            throw new QuotaExceededException("Query limit of " + maxQueriesPerHour + " per hour reached");
        }
    }
}
