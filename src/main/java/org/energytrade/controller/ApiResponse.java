package org.energytrade.controller;

import org.energytrade.exception.ErrorCode;
import org.energytrade.util.TraceIdUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一响应体 {code, message, data, traceId}
 */
final class ApiResponse {

    static final String SUCCESS = "SUCCESS";

    private ApiResponse() {
    }

    static ResponseEntity<Map<String, Object>> ok(String message, Object data) {
        return ResponseEntity.ok(body(SUCCESS, message, data));
    }

    static ResponseEntity<Map<String, Object>> error(ErrorCode errorCode, String message, Object data) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body(errorCode.getCode(), message, data));
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(code, message, null));
    }

    static Map<String, Object> body(String code, String message, Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("code", code);
        response.put("message", message);
        if (data != null) {
            response.put("data", data);
        }
        response.put("traceId", TraceIdUtil.getTraceId());
        return response;
    }
}
