package com.example.rcaengine.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON-RPC 2.0 envelope of the gateway: requests and responses carry an id,
 * incident stream pushes are notifications without one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcMessage {

    public static final String VERSION = "2.0";

    private String jsonrpc = VERSION;
    private String id;
    private String method;
    private Object params;
    private Object result;
    private JsonRpcError error;

    public enum ErrorCode {
        PARSE_ERROR(-32700),
        INVALID_REQUEST(-32600),
        METHOD_NOT_FOUND(-32601),
        INVALID_PARAMS(-32602),
        INTERNAL_ERROR(-32603);

        private final int code;

        ErrorCode(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    /**
     * @param data machine-readable detail, e.g. the incident a rejection refers to
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JsonRpcError(int code, String message, Map<String, Object> data) {
    }

    public static JsonRpcMessage request(String id, String method, Object params) {
        return new JsonRpcMessage(VERSION, id, method, params, null, null);
    }

    public static JsonRpcMessage success(String id, Object result) {
        return new JsonRpcMessage(VERSION, id, null, null, result, null);
    }

    public static JsonRpcMessage error(String id, ErrorCode code, String message) {
        return error(id, code, message, null);
    }

    public static JsonRpcMessage error(String id, ErrorCode code, String message, Map<String, Object> data) {
        return new JsonRpcMessage(VERSION, id, null, null, null, new JsonRpcError(code.code(), message, data));
    }

    public static JsonRpcMessage notification(String method, Object params) {
        return new JsonRpcMessage(VERSION, null, method, params, null, null);
    }

    /** A request without id, which gets no response. */
    @JsonIgnore
    public boolean isNotification() {
        return id == null && method != null;
    }
}
