package com.drover.core.inference;

import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.reactive.JdkClientHttpConnector;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Supplies the Spring HTTP client builders that Spring AI's model APIs are built on.
 */
interface ClientBuilders {

    /** Builder for blocking calls whose reads give up after {@code readTimeout}. */
    RestClient.Builder rest(Duration readTimeout);

    /** Builder for streaming calls. Idle timeouts are applied on the returned flux. */
    WebClient.Builder web();

    static ClientBuilders over(HttpClient httpClient) {
        return new ClientBuilders() {
            @Override
            public RestClient.Builder rest(Duration readTimeout) {
                var factory = new JdkClientHttpRequestFactory(httpClient);
                factory.setReadTimeout(readTimeout);
                return RestClient.builder().requestFactory(factory);
            }

            @Override
            public WebClient.Builder web() {
                return WebClient.builder().clientConnector(new JdkClientHttpConnector(httpClient));
            }
        };
    }
}
