package com.star.loginsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;
import org.springframework.data.elasticsearch.repository.config.EnableElasticsearchRepositories;
import org.springframework.lang.NonNull;

import java.time.Duration;

@Configuration
@EnableElasticsearchRepositories(basePackages = "com.star.loginsight.repository")
public class ElasticsearchConfig extends ElasticsearchConfiguration {

    private static final int DEFAULT_PORT = 9200;

    @Value("${spring.elasticsearch.uris:http://localhost:9200}")
    private String elasticsearchUrl;

    @Value("${spring.elasticsearch.username:}")
    private String username;

    @Value("${spring.elasticsearch.password:}")
    private String password;

    @Value("${spring.elasticsearch.connection-timeout:5s}")
    private Duration connectionTimeout;

    @Value("${spring.elasticsearch.socket-timeout:30s}")
    private Duration socketTimeout;

    @Override
    @NonNull
    public ClientConfiguration clientConfiguration() {
        boolean secure = elasticsearchUrl.trim().startsWith("https://");
        ClientConfiguration.MaybeSecureClientConfigurationBuilder builder =
                ClientConfiguration.builder()
                        .connectedTo(hostAndPort(elasticsearchUrl));

        ClientConfiguration.TerminalClientConfigurationBuilder terminal =
                secure ? builder.usingSsl() : builder;

        if (username != null && !username.isEmpty() && password != null && !password.isEmpty()) {
            terminal = terminal.withBasicAuth(username, password);
        }

        return terminal
                .withConnectTimeout(connectionTimeout)
                .withSocketTimeout(socketTimeout)
                .build();
    }

    // First configured URI only; "http://host" -> "host:9200".
    static String hostAndPort(String uris) {
        String first = uris.split(",")[0].trim();
        String hostPort = first.replaceFirst("^https?://", "");
        int slash = hostPort.indexOf('/');
        if (slash >= 0) {
            hostPort = hostPort.substring(0, slash);
        }
        if (!hostPort.contains(":")) {
            hostPort += ":" + DEFAULT_PORT;
        }
        return hostPort;
    }
}
