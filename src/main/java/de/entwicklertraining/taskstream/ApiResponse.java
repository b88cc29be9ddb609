package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.TaskStreamClient.ApiResponseUnusableException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.Optional;

/**
 * A successful response of a plain call, decoded from the backend's envelope
 * {@code {"status": true, "message": "...", "payload": ...}}.
 *
 * <p>Envelope fields are optional: a body that is a JSON object without them still yields a
 * response whose {@link #getPayload()} is empty. The raw body and the HTTP status stay
 * available for callers that need more than the envelope.
 */
public final class ApiResponse {
    private final int statusCode;
    private final String rawBody;
    private final JSONObject json;

    private ApiResponse(int statusCode, String rawBody, JSONObject json) {
        this.statusCode = statusCode;
        this.rawBody = rawBody;
        this.json = json;
    }

    /**
     * Decodes a 2xx response body.
     *
     * @param statusCode HTTP status
     * @param body the response body; blank bodies (e.g. 204) yield an empty envelope
     * @return the decoded response
     * @throws ApiResponseUnusableException if the body is not a JSON object
     */
    public static ApiResponse parse(int statusCode, String body) {
        if (body == null || body.isBlank()) {
            return new ApiResponse(statusCode, body == null ? "" : body, new JSONObject());
        }
        try {
            JSONTokener tokener = new JSONTokener(body);
            Object value = tokener.nextValue();
            if (!(value instanceof JSONObject)) {
                throw new ApiResponseUnusableException(
                        "Expected a JSON object response but got: " + abbreviate(body));
            }
            if (tokener.nextClean() != 0) {
                throw new ApiResponseUnusableException(
                        "Unexpected content after JSON response: " + abbreviate(body));
            }
            return new ApiResponse(statusCode, body, (JSONObject) value);
        } catch (JSONException e) {
            throw new ApiResponseUnusableException("Response is not valid JSON: " + abbreviate(body), e);
        }
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getRawBody() {
        return rawBody;
    }

    /**
     * The whole decoded body.
     *
     * @return the body as JSON object
     */
    public JSONObject getJson() {
        return json;
    }

    /**
     * The envelope's {@code status} flag. Missing means success, since the HTTP status
     * was 2xx.
     *
     * @return the flag
     */
    public boolean isStatus() {
        return json.optBoolean("status", true);
    }

    public Optional<String> getMessage() {
        if (!json.has("message") || json.isNull("message")) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(json.get("message")));
    }

    /**
     * The raw payload: a JSONObject, JSONArray, String, Number or Boolean.
     *
     * @return the payload, empty when absent or null
     */
    public Optional<Object> getPayload() {
        if (!json.has("payload") || json.isNull("payload")) {
            return Optional.empty();
        }
        return Optional.of(json.get("payload"));
    }

    /**
     * @return the payload as JSON object
     * @throws ApiResponseUnusableException if the payload is missing or not an object
     */
    public JSONObject getPayloadObject() {
        Object payload = getPayload().orElse(null);
        if (payload instanceof JSONObject object) {
            return object;
        }
        throw new ApiResponseUnusableException("Payload is not a JSON object: " + payload);
    }

    /**
     * @return the payload as JSON array
     * @throws ApiResponseUnusableException if the payload is missing or not an array
     */
    public JSONArray getPayloadArray() {
        Object payload = getPayload().orElse(null);
        if (payload instanceof JSONArray array) {
            return array;
        }
        throw new ApiResponseUnusableException("Payload is not a JSON array: " + payload);
    }

    @Override
    public String toString() {
        return "ApiResponse{status=" + statusCode + ", body=" + abbreviate(rawBody) + '}';
    }

    static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
