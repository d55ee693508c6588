package org.energytrade.controller;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.InvalidTransitionException;
import org.energytrade.exception.TradeException;
import org.energytrade.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 非协议接口的统一异常处理
 * 协议接口（discover/select/...）在业务层转换为NACK，不经过这里
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("[非法状态流转] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("currentState", e.getCurrentState());
        data.put("attemptedState", e.getAttemptedState());
        return ApiResponse.error(e.getErrorCode(), e.getMessage(), data);
    }

    @ExceptionHandler(TradeException.class)
    public ResponseEntity<Map<String, Object>> handleTradeException(TradeException e) {
        log.warn("[业务异常] errorCode={}, errorMsg={}, traceId={}",
                e.getErrorCode().getCode(), e.getMessage(), TraceIdUtil.getTraceId());
        return ApiResponse.error(e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("[请求格式错误] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId());
        return ApiResponse.error(ErrorCode.INVALID_REQUEST, "Malformed request: " + e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("[系统异常] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId(), e);
        return ApiResponse.error(ErrorCode.INTERNAL_ERROR, "Internal error", null);
    }
}
