package com.yerin.syncwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.syncwatch.application.SourceClient;
import com.yerin.syncwatch.domain.SyncSource;
import com.yerin.syncwatch.infra.HttpSourceClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SourceClientConfig {

    @Bean
    public SourceClient dwsSourceClient(SyncProperties properties, RestClient.Builder builder,
                                        ObjectMapper objectMapper) {
        return client(SyncSource.DWS, properties, builder, objectMapper);
    }

    @Bean
    public SourceClient treasurySourceClient(SyncProperties properties, RestClient.Builder builder,
                                             ObjectMapper objectMapper) {
        return client(SyncSource.TREASURY, properties, builder, objectMapper);
    }

    private static SourceClient client(SyncSource source, SyncProperties properties,
                                       RestClient.Builder builder, ObjectMapper objectMapper) {
        SyncProperties.SourceEndpoint endpoint =
                properties.getSources().getOrDefault(source.key(), new SyncProperties.SourceEndpoint());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) endpoint.getTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        // RestClient.Builder 빈은 프로토타입이 아니라서 소스마다 복제해서 쓴다
        RestClient restClient = builder.clone().requestFactory(requestFactory).build();
        return new HttpSourceClient(source, endpoint, restClient, objectMapper);
    }
}
