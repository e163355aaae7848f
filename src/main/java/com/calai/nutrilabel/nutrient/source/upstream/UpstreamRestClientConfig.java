package com.calai.nutrilabel.nutrient.source.upstream;

import com.calai.nutrilabel.nutrient.source.usda.UsdaProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties({UpstreamProperties.class, UsdaProperties.class})
public class UpstreamRestClientConfig {

    @Bean("offRestClient")
    public RestClient offRestClient(
            @Value("${app.openfoodfacts.base-url:https://world.openfoodfacts.org}") String baseUrl,
            @Value("${app.openfoodfacts.connect-timeout:PT3S}") Duration connectTimeout,
            @Value("${app.openfoodfacts.read-timeout:PT20S}") Duration readTimeout,
            @Value("${app.openfoodfacts.user-agent:nutrilabel-backend/0.1 (data-quality)}") String userAgent
    ) {
        return build(baseUrl, connectTimeout, readTimeout, userAgent);
    }

    @Bean("usdaRestClient")
    public RestClient usdaRestClient(
            @Value("${app.usda.base-url:https://api.nal.usda.gov}") String baseUrl,
            @Value("${app.usda.connect-timeout:PT3S}") Duration connectTimeout,
            @Value("${app.usda.read-timeout:PT25S}") Duration readTimeout,
            @Value("${app.usda.user-agent:nutrilabel-backend/0.1 (data-quality)}") String userAgent
    ) {
        return build(baseUrl, connectTimeout, readTimeout, userAgent);
    }

    static RestClient build(String baseUrl, Duration connectTimeout, Duration readTimeout, String userAgent) {
        HttpClient hc = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }
}
