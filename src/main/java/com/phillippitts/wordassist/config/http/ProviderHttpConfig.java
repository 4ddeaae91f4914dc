package com.phillippitts.wordassist.config.http;

import com.phillippitts.wordassist.config.properties.ProviderHttpProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used for provider calls.
 *
 * <p>Timeouts are configured via {@code wordassist.http.*}; orchestration applies none of its own.
 */
@Configuration
public class ProviderHttpConfig {

    @Bean
    public RestClient providerRestClient(RestClient.Builder builder, ProviderHttpProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getConnectTimeout());
        requestFactory.setReadTimeout(props.getReadTimeout());
        return builder.requestFactory(requestFactory).build();
    }
}
