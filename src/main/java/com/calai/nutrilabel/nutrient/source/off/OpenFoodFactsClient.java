package com.calai.nutrilabel.nutrient.source.off;

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

import java.util.List;

@Component
public class OpenFoodFactsClient {

    /** 只拿營養需要的欄位，payload 小很多 */
    static final List<String> FIELDS = List.of("code", "product_name", "brands", "nutriments");

    private final RestClient http;
    private final ObjectMapper om;

    public OpenFoodFactsClient(
            @Qualifier("offRestClient") RestClient http,
            ObjectMapper om
    ) {
        this.http = http;
        this.om = om;
    }

    /**
     * @param upc 已正規化的純數字 UPC
     * @throws UpstreamHttpException 4xx / 5xx（404 由呼叫端視為查無）
     * @throws UpstreamParseException 2xx 但 body 空 / 不是 JSON
     */
    public JsonNode getProduct(String upc) {

        String body = http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v2/product/{barcode}.json")
                        .queryParam("fields", String.join(",", FIELDS))
                        .build(upc))
                .retrieve()
                // ✅ 把 4xx/5xx 拉出來，不要混成 JSON parse fail
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new UpstreamHttpException(
                            Upstream.OPEN_FOOD_FACTS,
                            res.getStatusCode().value(),
                            HttpBodies.snippetQuietly(res)
                    );
                })
                .body(String.class);

        if (body == null || body.isBlank()) {
            throw new UpstreamParseException(
                    "OFF_EMPTY_BODY",
                    "OFF returned empty body (2xx) for upc=" + HttpBodies.safe(upc),
                    null,
                    null
            );
        }

        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            String snippet = HttpBodies.shrink(body, 300);
            throw new UpstreamParseException(
                    "OFF_JSON_PARSE_FAILED",
                    "OFF JSON parse failed (2xx). upc=" + HttpBodies.safe(upc) + ", snippet=" + snippet,
                    snippet,
                    e
            );
        }
    }
}
