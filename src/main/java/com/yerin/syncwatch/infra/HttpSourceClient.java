package com.yerin.syncwatch.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.application.ProgressListener;
import com.yerin.syncwatch.application.SourceClient;
import com.yerin.syncwatch.config.SyncProperties;
import com.yerin.syncwatch.domain.SourceRecord;
import com.yerin.syncwatch.domain.SyncSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 페이지 단위 JSON 엔드포인트를 읽는 소스 클라이언트.
 * URL 이 비어 있으면 아무 레코드도 만들지 않는다. 대체 데이터는 만들지 않는다.
 */
@Slf4j
public class HttpSourceClient implements SourceClient {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private final SyncSource source;
    private final SyncProperties.SourceEndpoint endpoint;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public HttpSourceClient(SyncSource source, SyncProperties.SourceEndpoint endpoint,
                            RestClient restClient, ObjectMapper objectMapper) {
        this.source = source;
        this.endpoint = endpoint;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SyncSource source() {
        return source;
    }

    @Override
    public List<SourceRecord> fetch(ProgressListener progress) {
        if (endpoint.getUrl() == null || endpoint.getUrl().isBlank()) {
            log.info("[Source.{}] no url configured, nothing to fetch", source.key());
            return List.of();
        }

        List<SourceRecord> records = new ArrayList<>();
        int maxPages = Math.max(1, endpoint.getMaxPages());
        for (int page = 1; page <= maxPages; page++) {
            if (progress.isCancelled()) break;

            JsonNode body = restClient.get().uri(pageUri(page)).retrieve().body(JsonNode.class);
            JsonNode rows = body == null ? null
                    : endpoint.getRecordsField() == null ? body : body.path(endpoint.getRecordsField());
            if (rows == null || !rows.isArray() || rows.isEmpty()) break;

            rows.forEach(row -> records.add(toRecord(row)));
            progress.onProgress(10 + (25 * page) / maxPages, "Fetched " + source.key() + " page " + page);
            log.debug("[Source.{}] page={}, rows={}", source.key(), page, rows.size());

            if (rows.size() < endpoint.getPageSize()) break;
        }
        log.info("[Source.{}] fetched records={}", source.key(), records.size());
        return records;
    }

    URI pageUri(int page) {
        return UriComponentsBuilder.fromUriString(endpoint.getUrl())
                .queryParam(endpoint.getPageParam(), page)
                .queryParam(endpoint.getSizeParam(), endpoint.getPageSize())
                .build()
                .toUri();
    }

    private SourceRecord toRecord(JsonNode row) {
        if (!row.isObject()) {
            return new SourceRecord(endpoint.getEntityType(), null, null);
        }
        JsonNode id = row.get(endpoint.getIdField());
        String externalId = id == null || id.isNull() ? null : id.asText();
        return new SourceRecord(endpoint.getEntityType(), externalId, objectMapper.convertValue(row, FIELDS));
    }
}
