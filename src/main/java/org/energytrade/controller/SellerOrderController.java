package org.energytrade.controller;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.util.IdempotencyKeyUtil;
import org.energytrade.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 卖方订单接口：取消、开始交付、交付完成
 */
@Slf4j
@RestController
@RequestMapping("/api/seller/orders")
public class SellerOrderController {

    private final OrderLifecycleService orderLifecycleService;
    private final IdempotencyKeyUtil idempotencyKeyUtil;

    public SellerOrderController(OrderLifecycleService orderLifecycleService, IdempotencyKeyUtil idempotencyKeyUtil) {
        this.orderLifecycleService = orderLifecycleService;
        this.idempotencyKeyUtil = idempotencyKeyUtil;
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable String orderId,
            @RequestBody(required = false) CancelRequest request,
            @RequestHeader(name = BuyerOrderController.IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        String providerId = request == null ? null : request.getProviderId();
        String reason = request == null ? null : request.getReason();
        log.info("[卖方取消请求] orderId={}, providerId={}, traceId={}", orderId, providerId, TraceIdUtil.getTraceId());
        return idempotencyKeyUtil.execute("seller-cancel:" + orderId, idempotencyKey,
                () -> ApiResponse.ok("Order cancelled", orderLifecycleService.cancelBySeller(orderId, providerId, reason)));
    }

    @PostMapping("/{orderId}/start-delivery")
    public ResponseEntity<Map<String, Object>> startDelivery(
            @PathVariable String orderId,
            @RequestHeader(name = BuyerOrderController.IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        return idempotencyKeyUtil.execute("start-delivery:" + orderId, idempotencyKey,
                () -> ApiResponse.ok("Delivery started", orderLifecycleService.startDelivery(orderId)));
    }

    @PostMapping("/{orderId}/delivered")
    public ResponseEntity<Map<String, Object>> delivered(
            @PathVariable String orderId,
            @RequestHeader(name = BuyerOrderController.IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {
        return idempotencyKeyUtil.execute("delivered:" + orderId, idempotencyKey,
                () -> ApiResponse.ok("Order delivered", orderLifecycleService.markDelivered(orderId)));
    }

    @Data
    public static class CancelRequest {
        private String providerId;
        private String reason;
    }
}
