package org.energytrade.controller;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.BlockStatus;
import org.energytrade.domain.CatalogItem;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferDeletion;
import org.energytrade.domain.OfferSyncResult;
import org.energytrade.domain.Participant;
import org.energytrade.domain.Provider;
import org.energytrade.domain.SourceType;
import org.energytrade.engine.TimeWindow;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.ValidationException;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.service.ICatalogService;
import org.energytrade.service.IParticipantService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 卖方侧目录同步接口
 * 所有接口按实体ID幂等
 */
@Slf4j
@RestController
@RequestMapping("/sync")
public class SyncController {

    private final ICatalogService catalogService;
    private final IBlockLedgerService blockLedgerService;
    private final IParticipantService participantService;

    public SyncController(ICatalogService catalogService,
                          IBlockLedgerService blockLedgerService,
                          IParticipantService participantService) {
        this.catalogService = catalogService;
        this.blockLedgerService = blockLedgerService;
        this.participantService = participantService;
    }

    @PostMapping("/provider")
    public ResponseEntity<Map<String, Object>> syncProvider(@RequestBody ProviderSyncRequest request) {
        Provider provider = catalogService.syncProvider(Provider.builder()
                .id(request.getId())
                .name(request.getName())
                .trustScore(request.getTrustScore())
                .build());
        return ApiResponse.ok("Provider synced", provider);
    }

    @PostMapping("/item")
    public ResponseEntity<Map<String, Object>> syncItem(@RequestBody ItemSyncRequest request) {
        CatalogItem item = catalogService.syncItem(CatalogItem.builder()
                .id(request.getId())
                .providerId(request.getProviderId())
                .sourceType(SourceType.parse(request.getSourceType()))
                .availableQty(request.getAvailableQty())
                .meterId(request.getMeterId())
                .build(), request.getProductionWindows());
        return ApiResponse.ok("Item synced", item);
    }

    @PostMapping("/offer")
    public ResponseEntity<Map<String, Object>> syncOffer(@RequestBody OfferSyncRequest request) {
        OfferSyncResult result = catalogService.syncOffer(Offer.builder()
                .id(request.getId())
                .itemId(request.getItemId())
                .providerId(request.getProviderId())
                .priceValue(request.getPrice())
                .currency(request.getCurrency() == null ? "INR" : request.getCurrency())
                .maxQty(request.getMaxQty())
                .windowStart(request.getTimeWindow() == null ? null : request.getTimeWindow().getStartTime())
                .windowEnd(request.getTimeWindow() == null ? null : request.getTimeWindow().getEndTime())
                .pricingModel(request.getPricingModel())
                .settlementType(request.getSettlementType())
                .build(), request.isResyncBlocks());
        return ApiResponse.ok(result.isCreated() ? "Offer created" : "Offer updated", result);
    }

    /**
     * 有在途区块（RESERVED/SOLD）的报价只做软删除，返回 OFFER_IN_USE
     */
    @DeleteMapping("/offer/{offerId}")
    public ResponseEntity<Map<String, Object>> deleteOffer(@PathVariable String offerId) {
        OfferDeletion deletion = catalogService.deleteOffer(offerId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("offerId", offerId);
        data.put("result", deletion);
        if (deletion == OfferDeletion.DISABLED) {
            return ApiResponse.error(ErrorCode.OFFER_IN_USE,
                    "Offer has reserved or sold blocks and was disabled instead of deleted", data);
        }
        return ApiResponse.ok(deletion == OfferDeletion.DELETED ? "Offer deleted" : "Offer not found", data);
    }

    @PostMapping("/offer/{offerId}/blocks/status")
    public ResponseEntity<Map<String, Object>> syncBlockStatus(@PathVariable String offerId,
                                                               @RequestBody BlockStatusSyncRequest request) {
        BlockStatus target = parseBlockStatus(request.getStatus());
        int changed = blockLedgerService.applyStatusSync(offerId, request.getBlockIds(), target,
                request.getOrderId(), request.getTransactionId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("offerId", offerId);
        data.put("changed", changed);
        data.put("blockStats", blockLedgerService.getBlockStats(offerId));
        log.info("[区块状态同步请求] offerId={}, status={}, changed={}, traceId={}",
                offerId, target, changed, TraceIdUtil.getTraceId());
        return ApiResponse.ok("Block status synced", data);
    }

    @PostMapping("/participant")
    public ResponseEntity<Map<String, Object>> syncParticipant(@RequestBody Participant participant) {
        return ApiResponse.ok("Participant synced", participantService.register(participant));
    }

    private static BlockStatus parseBlockStatus(String status) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        try {
            return BlockStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown block status " + status);
        }
    }

    @Data
    public static class ProviderSyncRequest {
        private String id;
        private String name;
        private Double trustScore;
    }

    @Data
    public static class ItemSyncRequest {
        private String id;
        private String providerId;
        private String sourceType;
        private Double availableQty;
        private String meterId;
        private List<TimeWindow> productionWindows;
    }

    @Data
    public static class OfferSyncRequest {
        private String id;
        private String itemId;
        private String providerId;
        private Double price;
        private String currency;
        private Integer maxQty;
        private TimeWindow timeWindow;
        private String pricingModel;
        private String settlementType;
        /**
         * true 时刷新AVAILABLE区块的价格/时间快照
         */
        private boolean resyncBlocks;
    }

    @Data
    public static class BlockStatusSyncRequest {
        private List<String> blockIds;
        private String status;
        private String orderId;
        private String transactionId;
    }
}
