package com.pokerplayer.strength.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.pokerplayer.evaluator.Card;
import com.pokerplayer.evaluator.HandCategory;
import com.pokerplayer.evaluator.InvalidCardException;
import com.pokerplayer.strength.config.OracleProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the external hand ranking service.
 *
 * <p>The request is a GET on {@code /rank} with a {@code cards} parameter holding a
 * JSON array of {@code {rank, suit}}. The response carries a rank code from 0 (high
 * card) to 8 (straight flush); the code cannot tell a royal flush apart, so an
 * ace-high code 8 whose cards hold ten through ace is mapped to
 * {@link HandCategory#ROYAL_FLUSH} here.
 *
 * <p>Each call makes exactly one attempt bounded by
 * {@link OracleProperties#getCallTimeout()}. A response that arrives later is
 * dropped. Every failure surfaces as {@link OracleUnavailableException}.
 */
@Component
public class RankOracleClient {

    private static final Logger log = LoggerFactory.getLogger(RankOracleClient.class);

    private static final HandCategory[] RANK_CODES = {
            HandCategory.HIGH_CARD,
            HandCategory.ONE_PAIR,
            HandCategory.TWO_PAIR,
            HandCategory.THREE_OF_A_KIND,
            HandCategory.STRAIGHT,
            HandCategory.FLUSH,
            HandCategory.FULL_HOUSE,
            HandCategory.FOUR_OF_A_KIND,
            HandCategory.STRAIGHT_FLUSH
    };

    private static final Set<Card.Rank> ROYAL_RANKS = EnumSet.range(Card.Rank.TEN, Card.Rank.ACE);

    private final OracleProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RankOracleClient(OracleProperties properties, HttpClient oracleHttpClient, ObjectMapper objectMapper) {
        if (properties.getCallTimeout().compareTo(properties.getRequestTimeout()) > 0) {
            throw new IllegalArgumentException("poker.oracle.call-timeout (" + properties.getCallTimeout()
                    + ") must not exceed poker.oracle.request-timeout (" + properties.getRequestTimeout() + ")");
        }
        this.properties = properties;
        this.httpClient = oracleHttpClient;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * Ranks the best five-card hand among the given cards.
     *
     * @param cards five to seven cards
     * @return the oracle's ranking
     * @throws OracleUnavailableException on timeout, transport failure, non-2xx status or malformed body
     */
    public OracleResult rank(List<Card> cards) throws OracleUnavailableException {
        try {
            HttpResponse<String> response = send(buildRequest(cards));
            if (response.statusCode() / 100 != 2) {
                throw new OracleUnavailableException("Oracle returned status " + response.statusCode());
            }
            return parse(response.body());
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleUnavailableException("Oracle call failed: " + e.getMessage(), e);
        }
    }

    private HttpRequest buildRequest(List<Card> cards) throws OracleUnavailableException {
        ArrayNode payload = objectMapper.createArrayNode();
        for (Card card : cards) {
            payload.addObject()
                    .put("rank", card.getRank().getSymbol())
                    .put("suit", card.getSuit().getWireName());
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new OracleUnavailableException("Failed to encode cards", e);
        }

        URI uri = URI.create(stripTrailingSlash(properties.getBaseUrl())
                + "/rank?cards=" + URLEncoder.encode(json, StandardCharsets.UTF_8));
        return HttpRequest.newBuilder(uri)
                .timeout(properties.getRequestTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) throws OracleUnavailableException {
        Duration deadline = properties.getCallTimeout();
        CompletableFuture<HttpResponse<String>> future =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleUnavailableException("Oracle did not answer within " + deadline.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OracleUnavailableException("Oracle request failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OracleUnavailableException("Interrupted while waiting for oracle", e);
        }
    }

    OracleResult parse(String body) throws OracleUnavailableException {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new OracleUnavailableException("Oracle body is not JSON", e);
        }
        if (json == null || !json.isObject()) {
            throw new OracleUnavailableException("Oracle body is not a JSON object");
        }

        int rankCode = requireInt(json, "rank");
        if (rankCode < 0 || rankCode >= RANK_CODES.length) {
            throw new OracleUnavailableException("Unknown oracle rank code " + rankCode);
        }
        int value = requireInt(json, "value");
        int secondValue = requireInt(json, "second_value");
        List<Integer> kickers = requireIntArray(json, "kickers");
        List<Card> cardsUsed = requireCardArray(json, "cards_used");
        List<Card> cards = requireCardArray(json, "cards");

        HandCategory category = RANK_CODES[rankCode];
        if (category == HandCategory.STRAIGHT_FLUSH && value == Card.Rank.ACE.getValue()
                && holdsTenToAce(cardsUsed.isEmpty() ? cards : cardsUsed)) {
            category = HandCategory.ROYAL_FLUSH;
        }

        log.debug("Oracle ranked {} as code {} ({}), value={}, second={}", cards, rankCode, category, value, secondValue);
        return OracleResult.builder()
                .category(category)
                .rankCode(rankCode)
                .value(value)
                .secondValue(secondValue)
                .kickers(kickers)
                .cardsUsed(cardsUsed)
                .cards(cards)
                .build();
    }

    private int requireInt(JsonNode json, String field) throws OracleUnavailableException {
        JsonNode node = json.get(field);
        if (node == null || !node.isInt()) {
            throw new OracleUnavailableException("Oracle field '" + field + "' missing or not an integer");
        }
        return node.intValue();
    }

    private List<Integer> requireIntArray(JsonNode json, String field) throws OracleUnavailableException {
        JsonNode node = requireArray(json, field);
        List<Integer> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isInt()) {
                throw new OracleUnavailableException("Oracle field '" + field + "' holds a non-integer");
            }
            values.add(element.intValue());
        }
        return values;
    }

    private List<Card> requireCardArray(JsonNode json, String field) throws OracleUnavailableException {
        JsonNode node = requireArray(json, field);
        List<Card> cards = new ArrayList<>();
        for (JsonNode element : node) {
            JsonNode rank = element.get("rank");
            JsonNode suit = element.get("suit");
            if (rank == null || suit == null || !rank.isTextual() || !suit.isTextual()) {
                throw new OracleUnavailableException("Oracle field '" + field + "' holds a malformed card");
            }
            try {
                cards.add(Card.parse(rank.textValue(), suit.textValue()));
            } catch (InvalidCardException e) {
                throw new OracleUnavailableException("Oracle field '" + field + "': " + e.getMessage(), e);
            }
        }
        return cards;
    }

    private JsonNode requireArray(JsonNode json, String field) throws OracleUnavailableException {
        JsonNode node = json.get(field);
        if (node == null || !node.isArray()) {
            throw new OracleUnavailableException("Oracle field '" + field + "' missing or not an array");
        }
        return node;
    }

    private static boolean holdsTenToAce(List<Card> cards) {
        Set<Card.Rank> ranks = EnumSet.noneOf(Card.Rank.class);
        cards.forEach(card -> ranks.add(card.getRank()));
        return ranks.containsAll(ROYAL_RANKS);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
