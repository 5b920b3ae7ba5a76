package com.phonepe.contextspace.storage;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.google.common.base.Strings;
import com.phonepe.contextspace.core.config.ContextSpaceEnv;
import com.phonepe.contextspace.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;

/**
 * Elasticsearch client wrapper shared by all elasticsearch backed stores
 */
public class ESClient implements AutoCloseable {
    @Getter
    private final ElasticsearchClient elasticsearchClient;

    @Builder
    public ESClient(@NonNull String serverUrl, String apiKey) {
        final var builder = RestClient.builder(HttpHost.create(serverUrl));
        if (!Strings.isNullOrEmpty(apiKey)) {
            builder.setDefaultHeaders(new Header[]{
                    new BasicHeader("Authorization", "ApiKey " + apiKey)
            });
        }
        ElasticsearchTransport transport = new RestClientTransport(
                builder.build(), new JacksonJsonpMapper(JsonUtils.createMapper()));
        this.elasticsearchClient = new ElasticsearchClient(transport);
    }

    public static ESClient fromEnvironment(ContextSpaceEnv env) {
        return ESClient.builder()
                .serverUrl(env.getEsUrl())
                .apiKey(env.getEsApiKey())
                .build();
    }

    @Override
    public void close() throws Exception {
        elasticsearchClient.close();
    }
}
