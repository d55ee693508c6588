package org.energytrade.controller;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.domain.TradeOrder;
import org.energytrade.service.IOrderService;
import org.energytrade.util.IdempotencyKeyUtil;
import org.energytrade.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 买方订单接口
 * 写接口支持 X-Idempotency-Key，重试时返回首次的结果
 */
@Slf4j
@RestController
@RequestMapping("/api/buyer/orders")
public class BuyerOrderController {

    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    private final OrderLifecycleService orderLifecycleService;
    private final IOrderService orderService;
    private final IdempotencyKeyUtil idempotencyKeyUtil;

    public BuyerOrderController(OrderLifecycleService orderLifecycleService,
                                IOrderService orderService,
                                IdempotencyKeyUtil idempotencyKeyUtil) {
        this.orderLifecycleService = orderLifecycleService;
        this.orderService = orderService;
        this.idempotencyKeyUtil = idempotencyKeyUtil;
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> getOrder(@PathVariable String orderId) {
        return ApiResponse.ok("OK", orderService.getRequired(orderId));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable String orderId,
            @RequestBody(required = false) CancelRequest request,
            @RequestHeader(name = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        String buyerId = request == null ? null : request.getBuyerId();
        String reason = request == null ? null : request.getReason();
        log.info("[买方取消请求] orderId={}, buyerId={}, idempotencyKey={}, traceId={}",
                orderId, buyerId, idempotencyKey, TraceIdUtil.getTraceId());
        return idempotencyKeyUtil.execute("buyer-cancel:" + orderId, idempotencyKey, () -> {
            TradeOrder order = orderLifecycleService.cancelByBuyer(orderId, buyerId, reason);
            return ApiResponse.ok("Order cancelled", order);
        });
    }

    @Data
    public static class CancelRequest {
        private String buyerId;
        private String reason;
    }
}
