package com.calai.nutrilabel.nutrient.source.usda;

import com.calai.nutrilabel.nutrient.source.upstream.HttpBodies;
import com.calai.nutrilabel.nutrient.source.upstream.Upstream;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamHttpException;
import com.calai.nutrilabel.nutrient.source.upstream.UpstreamParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * USDA FoodData Central
 * - search：GET /fdc/v1/foods/search
 * - food：GET /fdc/v1/food/{fdcId}
 */
@Component
public class UsdaFoodDataClient {

    private final RestClient http;
    private final ObjectMapper om;
    private final UsdaProperties props;

    public UsdaFoodDataClient(
            @Qualifier("usdaRestClient") RestClient http,
            ObjectMapper om,
            UsdaProperties props
    ) {
        this.http = http;
        this.om = om;
        this.props = props;
    }

    public JsonNode search(UsdaSearchQuery q) {
        String body = http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/fdc/v1/foods/search")
                        .queryParam("api_key", props.apiKeyOrDefault())
                        .queryParam("query", q.query())
                        .queryParam("pageSize", q.pageSize())
                        .queryParam("dataType", q.dataTypes().toArray())
                        .queryParam("requireAllWords", q.requireAllWords())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new UpstreamHttpException(Upstream.USDA_FDC, res.getStatusCode().value(), HttpBodies.snippetQuietly(res));
                })
                .body(String.class);
        return parse(body, "search");
    }

    public JsonNode food(long fdcId) {
        String body = http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/fdc/v1/food/{fdcId}")
                        .queryParam("api_key", props.apiKeyOrDefault())
                        .build(fdcId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new UpstreamHttpException(Upstream.USDA_FDC, res.getStatusCode().value(), HttpBodies.snippetQuietly(res));
                })
                .body(String.class);
        return parse(body, "food:" + fdcId);
    }

    private JsonNode parse(String body, String op) {
        if (body == null || body.isBlank()) {
            throw new UpstreamParseException("USDA_EMPTY_BODY", "USDA returned empty body (2xx) op=" + op, null, null);
        }
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            String snippet = HttpBodies.shrink(body, 300);
            throw new UpstreamParseException("USDA_JSON_PARSE_FAILED",
                    "USDA JSON parse failed (2xx). op=" + op + ", snippet=" + snippet, snippet, e);
        }
    }
}
