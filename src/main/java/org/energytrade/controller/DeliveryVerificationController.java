package org.energytrade.controller;

import lombok.Data;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.exception.ValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 交付核验入口（HTTP），与MQ消费走同一业务方法
 */
@RestController
public class DeliveryVerificationController {

    private final OrderLifecycleService orderLifecycleService;

    public DeliveryVerificationController(OrderLifecycleService orderLifecycleService) {
        this.orderLifecycleService = orderLifecycleService;
    }

    @PostMapping("/api/verification/delivery")
    public ResponseEntity<Map<String, Object>> verifyDelivery(@RequestBody DeliveryVerificationRequest request) {
        if (request.getOrderId() == null || request.getDeliveredQty() == null) {
            throw new ValidationException("order_id and delivered_qty are required");
        }
        return ApiResponse.ok("Delivery verified",
                orderLifecycleService.applyDeliveryVerification(request.getOrderId(), request.getDeliveredQty()));
    }

    @Data
    public static class DeliveryVerificationRequest {
        private String orderId;
        private Double deliveredQty;
    }
}
