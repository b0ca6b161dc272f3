package com.prime.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.prime.client.error.AuthException;
import com.prime.client.error.NoResultException;
import com.prime.client.error.NotFoundException;
import com.prime.client.error.PrimeApiException;
import com.prime.client.error.RequestException;
import com.prime.client.error.ServerException;

/**
 * Maps a raw HTTP status and body to either the decoded JSON payload or a typed
 * {@link PrimeApiException}.
 *
 * <p>The mapping is total: every status code other than 200 raises exactly one
 * exception type, unknown codes falling through to a generic
 * {@link RequestException}.</p>
 *
 * <p>Older API versions signal an empty data query at this level through a
 * zero count in the query envelope. That check is only applied by
 * {@link #classifyQuery(HttpResult)} and only when enabled.</p>
 */
public class ResponseClassifier {

    private final ObjectMapper objectMapper;
    private final boolean zeroCountCheck;

    public ResponseClassifier(ObjectMapper objectMapper) {
        this(objectMapper, false);
    }

    public ResponseClassifier(ObjectMapper objectMapper, boolean zeroCountCheck) {
        this.objectMapper = objectMapper;
        this.zeroCountCheck = zeroCountCheck;
    }

    /**
     * Classifies a response. Returns the parsed payload on 200.
     *
     * @throws PrimeApiException for any other status
     */
    public JsonNode classify(HttpResult result) {
        int status = result.statusCode();
        String url = result.url();
        return switch (status) {
            case 200 -> parse(result);
            case 302 -> throw new AuthException("Incorrect credentials provided", url, status);
            case 400 -> throw new RequestException(badRequestMessage(result), url, status);
            case 401 -> throw new AuthException("Unauthorized access", url, status);
            case 403 -> throw new AuthException("Forbidden access to the REST API", url, status);
            case 404 -> throw new NotFoundException("URL not found " + url, url);
            case 406 -> throw new RequestException(
                    "The Accept header sent in the request does not match a supported type", url, status);
            case 415 -> throw new RequestException(
                    "The Content-Type header sent in the request does not match a supported type", url, status);
            case 500 -> throw new ServerException("An error has occurred during the API invocation", url, status);
            case 502 -> throw new ServerException("The server is down or being upgraded", url, status);
            case 503 -> throw new ServerException(
                    "The servers are up, but overloaded with requests. Try again later (rate limiting)", url, status);
            default -> throw new RequestException("Unknown request error, return code is " + status, url, status);
        };
    }

    /**
     * Classifies a data-query response, additionally raising
     * {@link NoResultException} for a zero-count envelope when the check is enabled.
     */
    public JsonNode classifyQuery(HttpResult result) {
        JsonNode payload = classify(result);
        if (zeroCountCheck) {
            QueryEnvelope envelope = QueryEnvelope.of(payload);
            if (envelope.present() && envelope.count() == 0) {
                throw new NoResultException("No result found for the query " + result.url(), result.url(), null);
            }
        }
        return payload;
    }

    public boolean isZeroCountCheck() {
        return zeroCountCheck;
    }

    private JsonNode parse(HttpResult result) {
        if (result.body().isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new ServerException("Malformed JSON response from " + result.url() + ": "
                    + e.getOriginalMessage(), result.url(), result.statusCode());
        }
    }

    private String badRequestMessage(HttpResult result) {
        String detail = embeddedMessage(result.body());
        return detail != null
                ? "Invalid request " + result.url() + ": " + detail
                : "Invalid request " + result.url();
    }

    // {"errorDocument": {"httpResponseCode": 400, "message": "..."}}
    private String embeddedMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode message = objectMapper.readTree(body).findValue("message");
            return message != null && message.isValueNode() && !message.asText().isBlank()
                    ? message.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
