package org.energytrade.controller;

import org.energytrade.business.TransactionProtocolService;
import org.energytrade.domain.ProtocolTransaction;
import org.energytrade.exception.ErrorCode;
import org.energytrade.protocol.AckResponse;
import org.energytrade.protocol.CancelMessage;
import org.energytrade.protocol.DiscoverMessage;
import org.energytrade.protocol.OrderMessage;
import org.energytrade.protocol.ProtocolRequest;
import org.energytrade.protocol.StatusMessage;
import org.energytrade.service.IProtocolTransactionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 交易协议入口
 * 每个请求立即返回ACK/NACK，处理结果通过 on_{action} 回调送达
 */
@RestController
public class ProtocolController {

    private final TransactionProtocolService protocolService;
    private final IProtocolTransactionService protocolTransactionService;

    public ProtocolController(TransactionProtocolService protocolService,
                              IProtocolTransactionService protocolTransactionService) {
        this.protocolService = protocolService;
        this.protocolTransactionService = protocolTransactionService;
    }

    @PostMapping("/discover")
    public ResponseEntity<AckResponse> discover(@RequestBody ProtocolRequest<DiscoverMessage> request) {
        return toResponse(protocolService.discover(request));
    }

    @PostMapping("/select")
    public ResponseEntity<AckResponse> select(@RequestBody ProtocolRequest<OrderMessage> request) {
        return toResponse(protocolService.select(request));
    }

    @PostMapping("/init")
    public ResponseEntity<AckResponse> init(@RequestBody ProtocolRequest<OrderMessage> request) {
        return toResponse(protocolService.init(request));
    }

    @PostMapping("/confirm")
    public ResponseEntity<AckResponse> confirm(@RequestBody ProtocolRequest<OrderMessage> request) {
        return toResponse(protocolService.confirm(request));
    }

    @PostMapping("/cancel")
    public ResponseEntity<AckResponse> cancel(@RequestBody ProtocolRequest<CancelMessage> request) {
        return toResponse(protocolService.cancel(request));
    }

    @PostMapping("/status")
    public ResponseEntity<AckResponse> status(@RequestBody ProtocolRequest<StatusMessage> request) {
        return toResponse(protocolService.status(request));
    }

    /**
     * 事务处理状态查询，异步失败在这里可见
     */
    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<Map<String, Object>> transactionStatus(@PathVariable String transactionId) {
        List<ProtocolTransaction> messages = protocolTransactionService.listByTransaction(transactionId);
        if (messages.isEmpty()) {
            return ApiResponse.error(HttpStatus.NOT_FOUND, ErrorCode.INVALID_REQUEST.getCode(), "Unknown transaction " + transactionId);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transactionId", transactionId);
        data.put("messages", messages);
        return ApiResponse.ok("OK", data);
    }

    private static ResponseEntity<AckResponse> toResponse(AckResponse ack) {
        if (ack.isAck()) {
            return ResponseEntity.ok(ack);
        }
        return ResponseEntity.status(ErrorCode.ofCode(ack.getError().getCode()).getHttpStatus()).body(ack);
    }
}
