package org.energytrade.business;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.AuthenticatedPrincipal;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.ProtocolState;
import org.energytrade.domain.Provider;
import org.energytrade.domain.Offer;
import org.energytrade.domain.TradeOrder;
import org.energytrade.engine.FilterCriteria;
import org.energytrade.engine.FilterExpressionParser;
import org.energytrade.engine.MatchingCriteria;
import org.energytrade.engine.MatchingEngine;
import org.energytrade.engine.MatchingResult;
import org.energytrade.engine.ScorableOffer;
import org.energytrade.engine.TrustEngine;
import org.energytrade.exception.DuplicateMessageException;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.InsufficientAvailableException;
import org.energytrade.exception.TradeException;
import org.energytrade.exception.ValidationException;
import org.energytrade.protocol.AckResponse;
import org.energytrade.protocol.CancelMessage;
import org.energytrade.protocol.CatalogView;
import org.energytrade.protocol.DiscoverMessage;
import org.energytrade.protocol.DiscoverPayload;
import org.energytrade.protocol.OrderMessage;
import org.energytrade.protocol.OrderPayload;
import org.energytrade.protocol.ProtocolContext;
import org.energytrade.protocol.ProtocolRequest;
import org.energytrade.protocol.Quote;
import org.energytrade.protocol.StatusMessage;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.service.ICatalogService;
import org.energytrade.service.IEventService;
import org.energytrade.service.IOrderService;
import org.energytrade.service.IPrincipalLookup;
import org.energytrade.service.IProtocolTransactionService;
import org.energytrade.service.IWalletService;
import org.energytrade.task.ProtocolTaskDispatcher;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 交易协议驱动 - 业务编排层
 *
 * 每条入站消息的处理顺序：
 * 1. 入站去重（缓存 → 数据库），重复消息直接ACK，不再处理也不再回调
 * 2. 同步校验，失败返回NACK且不记录消息
 * 3. 记录INBOUND事件与处理状态，立即ACK
 * 4. 异步任务完成业务处理并投递 on_{action} 回调
 */
@Slf4j
@Service
public class TransactionProtocolService {

    public static final String DISCOVER = "discover";
    public static final String SELECT = "select";
    public static final String INIT = "init";
    public static final String CONFIRM = "confirm";
    public static final String CANCEL = "cancel";
    public static final String STATUS = "status";

    public static final String FULFILLMENT_PENDING = "PENDING";
    public static final String FULFILLMENT_IN_PROGRESS = "IN_PROGRESS";
    public static final String FULFILLMENT_COMPLETED = "COMPLETED";
    public static final String FULFILLMENT_CANCELLED = "CANCELLED";

    private final IEventService eventService;
    private final IProtocolTransactionService protocolTransactionService;
    private final ICatalogService catalogService;
    private final IBlockLedgerService blockLedgerService;
    private final IOrderService orderService;
    private final IPrincipalLookup principalLookup;
    private final IWalletService walletService;
    private final OrderLifecycleService orderLifecycleService;
    private final MatchingEngine matchingEngine;
    private final TrustEngine trustEngine;
    private final FilterExpressionParser filterExpressionParser;
    private final ProtocolTaskDispatcher taskDispatcher;
    private final ObjectMapper objectMapper;

    public TransactionProtocolService(IEventService eventService,
                                      IProtocolTransactionService protocolTransactionService,
                                      ICatalogService catalogService,
                                      IBlockLedgerService blockLedgerService,
                                      IOrderService orderService,
                                      IPrincipalLookup principalLookup,
                                      IWalletService walletService,
                                      OrderLifecycleService orderLifecycleService,
                                      MatchingEngine matchingEngine,
                                      TrustEngine trustEngine,
                                      FilterExpressionParser filterExpressionParser,
                                      ProtocolTaskDispatcher taskDispatcher,
                                      ObjectMapper objectMapper) {
        this.eventService = eventService;
        this.protocolTransactionService = protocolTransactionService;
        this.catalogService = catalogService;
        this.blockLedgerService = blockLedgerService;
        this.orderService = orderService;
        this.principalLookup = principalLookup;
        this.walletService = walletService;
        this.orderLifecycleService = orderLifecycleService;
        this.matchingEngine = matchingEngine;
        this.trustEngine = trustEngine;
        this.filterExpressionParser = filterExpressionParser;
        this.taskDispatcher = taskDispatcher;
        this.objectMapper = objectMapper;
    }

    // ==================== 协议入口 ====================

    public AckResponse discover(ProtocolRequest<DiscoverMessage> request) {
        DiscoverMessage message = request.getMessage() == null ? new DiscoverMessage() : request.getMessage();
        return accept(DISCOVER, request, () -> {
        }, () -> runDiscovery(message));
    }

    public AckResponse select(ProtocolRequest<OrderMessage> request) {
        return accept(SELECT, request,
                () -> requireSelection(request.getMessage(), false),
                () -> quote(requireSelection(request.getMessage(), false)));
    }

    public AckResponse init(ProtocolRequest<OrderMessage> request) {
        return accept(INIT, request,
                () -> validateInit(requireSelection(request.getMessage(), true)),
                () -> validateInit(requireSelection(request.getMessage(), true)));
    }

    public AckResponse confirm(ProtocolRequest<OrderMessage> request) {
        return accept(CONFIRM, request,
                () -> requireSelection(request.getMessage(), true),
                () -> confirmOrder(request.getContext().getTransactionId(), requireSelection(request.getMessage(), true)));
    }

    public AckResponse cancel(ProtocolRequest<CancelMessage> request) {
        return accept(CANCEL, request,
                () -> requireOrderId(request.getMessage() == null ? null : request.getMessage().getOrderId()),
                () -> {
                    CancelMessage message = request.getMessage();
                    TradeOrder order = orderLifecycleService.cancelByBuyer(
                            message.getOrderId(), message.getBuyerId(), message.getReason());
                    return orderPayload(order, null);
                });
    }

    public AckResponse status(ProtocolRequest<StatusMessage> request) {
        return accept(STATUS, request, () -> {
        }, () -> {
            String orderId = request.getMessage() == null ? null : request.getMessage().getOrderId();
            TradeOrder order = orderId != null
                    ? orderService.getRequired(orderId)
                    : orderService.findByTransaction(request.getContext().getTransactionId());
            if (order == null) {
                throw new ValidationException(ErrorCode.ORDER_NOT_FOUND,
                        "No order for transaction " + request.getContext().getTransactionId());
            }
            List<String> blockIds = blockLedgerService.listByOrder(order.getId()).stream()
                    .map(block -> block.getId())
                    .toList();
            return orderPayload(order, blockIds);
        });
    }

    /**
     * 统一的 去重 → 校验 → 记录 → ACK → 异步处理 流程
     */
    private AckResponse accept(String action, ProtocolRequest<?> request, Runnable syncValidation,
                               Supplier<Object> processor) {
        ProtocolContext context = request.getContext();
        if (context == null || isBlank(context.getTransactionId()) || isBlank(context.getMessageId())) {
            return AckResponse.nack(context, ErrorCode.INVALID_REQUEST.getCode(),
                    "context.transaction_id and context.message_id are required");
        }
        context.setAction(action);
        String messageId = context.getMessageId();
        String traceId = TraceIdUtil.getTraceId();

        try {
            // ==================== 1. 入站去重 ====================
            if (eventService.isDuplicateInbound(messageId)) {
                log.info("[重复消息] action={}, transactionId={}, messageId={}, traceId={}",
                        action, context.getTransactionId(), messageId, traceId);
                return AckResponse.ack(context);
            }

            // ==================== 2. 同步校验 ====================
            try {
                syncValidation.run();
            } catch (TradeException e) {
                log.warn("[同步校验失败] action={}, transactionId={}, messageId={}, errorCode={}, errorMsg={}, traceId={}",
                        action, context.getTransactionId(), messageId, e.getErrorCode().getCode(), e.getMessage(), traceId);
                return AckResponse.nack(context, e.getErrorCode().getCode(), e.getMessage());
            }

            // ==================== 3. 记录入站消息 ====================
            try {
                eventService.recordInbound(context.getTransactionId(), messageId, action, toJson(request));
            } catch (DuplicateMessageException e) {
                log.info("[重复消息-并发写入] action={}, messageId={}, traceId={}", action, messageId, traceId);
                return AckResponse.ack(context);
            }
            try {
                protocolTransactionService.markReceived(messageId, context.getTransactionId(), action,
                        context.resolveCallbackUri());
                protocolTransactionService.updateState(messageId, ProtocolState.ACKED);

                // ==================== 4. 异步处理 ====================
                taskDispatcher.dispatch(context, processor);
            } catch (RuntimeException e) {
                rollbackAcceptance(action, messageId, e);
                throw e;
            }
            return AckResponse.ack(context);
        } catch (TradeException e) {
            log.warn("[协议受理失败] action={}, messageId={}, errorCode={}, errorMsg={}, traceId={}",
                    action, messageId, e.getErrorCode().getCode(), e.getMessage(), traceId);
            return AckResponse.nack(context, e.getErrorCode().getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[协议受理异常] action={}, messageId={}, errorMsg={}, traceId={}",
                    action, messageId, e.getMessage(), traceId, e);
            return AckResponse.nack(context, ErrorCode.INTERNAL_ERROR.getCode(), "Internal error");
        }
    }

    /**
     * 受理中途失败：撤销入站记录，重发的同一消息可以重新受理
     * 已写入的状态行标记为FAILED，轮询可见
     */
    private void rollbackAcceptance(String action, String messageId, RuntimeException cause) {
        String errorCode = cause instanceof TradeException
                ? ((TradeException) cause).getErrorCode().getCode()
                : ErrorCode.INTERNAL_ERROR.getCode();
        try {
            eventService.discardInbound(messageId);
            protocolTransactionService.markFailed(messageId, errorCode, cause.getMessage());
        } catch (RuntimeException e) {
            log.error("[受理回滚失败] action={}, messageId={}, errorMsg={}, traceId={}",
                    action, messageId, e.getMessage(), TraceIdUtil.getTraceId(), e);
            cause.addSuppressed(e);
        }
    }

    // ==================== discover ====================

    DiscoverPayload runDiscovery(DiscoverMessage message) {
        DiscoverMessage.Intent intent = message.getIntent() == null ? new DiscoverMessage.Intent() : message.getIntent();
        String expression = message.getFilters() == null ? null : message.getFilters().getExpression();

        FilterCriteria criteria = filterExpressionParser.merge(filterExpressionParser.parse(expression),
                intent.getSourceType(), intent.getQuantity(), intent.getTimeWindow());
        CatalogView catalog = catalogService.getCatalog(criteria);

        List<ScorableOffer> offers = new ArrayList<>();
        Map<String, Provider> providers = new HashMap<>();
        for (CatalogView.ProviderEntry providerEntry : catalog.getProviders()) {
            providers.put(providerEntry.getId(), Provider.builder()
                    .id(providerEntry.getId())
                    .name(providerEntry.getName())
                    .trustScore(providerEntry.getTrustScore())
                    .build());
            for (CatalogView.ItemEntry item : providerEntry.getItems()) {
                for (CatalogView.OfferEntry offer : item.getOffers()) {
                    offers.add(ScorableOffer.builder()
                            .offerId(offer.getId())
                            .itemId(offer.getItemId())
                            .providerId(offer.getProviderId())
                            .sourceType(item.getSourceType())
                            .price(offer.getPrice())
                            .currency(offer.getCurrency())
                            .availableBlocks(offer.getMaxQuantity())
                            .timeWindow(offer.getTimeWindow())
                            .build());
                }
            }
        }

        MatchingResult result = matchingEngine.match(offers, providers, MatchingCriteria.builder()
                .requestedQuantity(intent.getQuantity() == null ? 0 : intent.getQuantity())
                .requestedTimeWindow(intent.getTimeWindow())
                .maxPrice(intent.getMaxPrice())
                .build());
        log.info("[匹配完成] offers={}, eligible={}, selectedOfferId={}, traceId={}",
                offers.size(), result.getEligibleCount(),
                result.getSelectedOffer() == null ? null : result.getSelectedOffer().getOffer().getOfferId(),
                TraceIdUtil.getTraceId());
        return DiscoverPayload.builder()
                .catalog(catalog)
                .eligibleCount(result.getEligibleCount())
                .selectedOfferId(result.getSelectedOffer() == null ? null : result.getSelectedOffer().getOffer().getOfferId())
                .rankedOffers(result.getAllOffers())
                .build();
    }

    // ==================== select / init / confirm ====================

    /**
     * 报价：报价必须上架，数量不超过当前可用区块数
     */
    Quote quote(OrderMessage.OrderSelection selection) {
        Offer offer = catalogService.getActiveOffer(selection.getOfferId());
        if (selection.getItemId() != null && !selection.getItemId().equals(offer.getItemId())) {
            throw new ValidationException("Offer " + offer.getId() + " does not belong to item " + selection.getItemId());
        }
        int available = blockLedgerService.countAvailable(offer.getId());
        if (selection.getQuantity() > available) {
            throw new InsufficientAvailableException(offer.getId(), selection.getQuantity(), available);
        }
        double unitPrice = offer.getPriceValue() == null ? 0 : offer.getPriceValue();
        return Quote.builder()
                .offerId(offer.getId())
                .itemId(offer.getItemId())
                .providerId(offer.getProviderId())
                .buyerId(selection.getBuyerId())
                .quantity(selection.getQuantity())
                .unitPrice(unitPrice)
                .totalPrice(Math.round(unitPrice * selection.getQuantity() * 100.0) / 100.0)
                .currency(offer.getCurrency())
                .availableQuantity(available)
                .build();
    }

    /**
     * init 校验：可用量、买方余额、信任档位额度
     */
    Quote validateInit(OrderMessage.OrderSelection selection) {
        Quote quote = quote(selection);
        String buyerId = selection.getBuyerId();
        AuthenticatedPrincipal principal = principalLookup.findPrincipal(buyerId)
                .orElseThrow(() -> new ValidationException(ErrorCode.PARTICIPANT_NOT_FOUND,
                        "Unknown buyer " + buyerId));

        if (!walletService.hasSufficientFunds(buyerId, quote.getTotalPrice())) {
            throw new ValidationException(ErrorCode.INSUFFICIENT_FUNDS,
                    "Insufficient funds for buyer " + buyerId + ": required " + quote.getTotalPrice());
        }
        if (principal.getDeclaredCapacity() > 0) {
            double allowed = trustEngine.allowedTradeQuantity(principal.getDeclaredCapacity(), principal.getTrustScore());
            long open = orderService.openQuantityOfBuyer(buyerId);
            if (open + selection.getQuantity() > allowed) {
                throw new ValidationException(ErrorCode.TRADE_LIMIT_EXCEEDED,
                        "Trade quantity " + (open + selection.getQuantity()) + " exceeds limit " + allowed
                                + " for buyer " + buyerId);
            }
        }
        return quote;
    }

    OrderPayload confirmOrder(String transactionId, OrderMessage.OrderSelection selection) {
        Offer offer = catalogService.getActiveOffer(selection.getOfferId());
        double unitPrice = offer.getPriceValue() == null ? 0 : offer.getPriceValue();
        ConfirmedOrder confirmed = orderLifecycleService.confirmOrder(OrderDraft.builder()
                .transactionId(transactionId)
                .buyerId(selection.getBuyerId())
                .providerId(offer.getProviderId())
                .offerId(offer.getId())
                .itemId(offer.getItemId())
                .quantity(selection.getQuantity())
                .totalPrice(Math.round(unitPrice * selection.getQuantity() * 100.0) / 100.0)
                .currency(offer.getCurrency())
                .deliveryStart(offer.getWindowStart())
                .deliveryEnd(offer.getWindowEnd())
                .build());
        return orderPayload(confirmed.getOrder(), confirmed.getBlockIds());
    }

    private OrderPayload orderPayload(TradeOrder order, List<String> blockIds) {
        return OrderPayload.builder()
                .order(order)
                .fulfillmentState(fulfillmentState(order.getStatus()))
                .blockIds(blockIds)
                .blockStats(blockLedgerService.getBlockStats(order.getOfferId()))
                .build();
    }

    public static String fulfillmentState(OrderStatus status) {
        if (status == null) {
            return FULFILLMENT_PENDING;
        }
        switch (status) {
            case ACTIVE:
            case DELIVERING:
                return FULFILLMENT_IN_PROGRESS;
            case DELIVERED:
            case COMPLETED:
                return FULFILLMENT_COMPLETED;
            case CANCELLED:
                return FULFILLMENT_CANCELLED;
            default:
                return FULFILLMENT_PENDING;
        }
    }

    // ==================== 校验工具 ====================

    private OrderMessage.OrderSelection requireSelection(OrderMessage message, boolean buyerRequired) {
        OrderMessage.OrderSelection selection = message == null ? null : message.getOrder();
        if (selection == null || isBlank(selection.getOfferId())) {
            throw new ValidationException("message.order.offer_id is required");
        }
        if (selection.getQuantity() == null || selection.getQuantity() <= 0) {
            throw new ValidationException("message.order.quantity must be a positive integer");
        }
        if (buyerRequired && isBlank(selection.getBuyerId())) {
            throw new ValidationException("message.order.buyer_id is required");
        }
        return selection;
    }

    private void requireOrderId(String orderId) {
        if (isBlank(orderId)) {
            throw new ValidationException("message.order_id is required");
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TradeException(ErrorCode.INVALID_REQUEST, "Cannot serialize request", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
