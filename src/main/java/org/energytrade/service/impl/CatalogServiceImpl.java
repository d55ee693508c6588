package org.energytrade.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.BlockStats;
import org.energytrade.domain.CatalogItem;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferDeletion;
import org.energytrade.domain.OfferStatus;
import org.energytrade.domain.OfferSyncResult;
import org.energytrade.domain.Participant;
import org.energytrade.domain.Provider;
import org.energytrade.domain.SourceType;
import org.energytrade.engine.FilterCriteria;
import org.energytrade.engine.TimeWindow;
import org.energytrade.engine.TrustEngine;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.TradeException;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.CatalogItemMapper;
import org.energytrade.mapper.OfferBlockMapper;
import org.energytrade.mapper.OfferMapper;
import org.energytrade.mapper.ProviderMapper;
import org.energytrade.protocol.CatalogView;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.service.ICatalogService;
import org.energytrade.service.IParticipantService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 目录服务实现
 */
@Slf4j
@Service
public class CatalogServiceImpl implements ICatalogService {

    private static final TypeReference<List<TimeWindow>> WINDOW_LIST = new TypeReference<>() {
    };

    private final ProviderMapper providerMapper;
    private final CatalogItemMapper catalogItemMapper;
    private final OfferMapper offerMapper;
    private final OfferBlockMapper offerBlockMapper;
    private final IBlockLedgerService blockLedgerService;
    private final IParticipantService participantService;
    private final TrustEngine trustEngine;
    private final ObjectMapper objectMapper;

    public CatalogServiceImpl(ProviderMapper providerMapper,
                              CatalogItemMapper catalogItemMapper,
                              OfferMapper offerMapper,
                              OfferBlockMapper offerBlockMapper,
                              IBlockLedgerService blockLedgerService,
                              IParticipantService participantService,
                              TrustEngine trustEngine,
                              ObjectMapper objectMapper) {
        this.providerMapper = providerMapper;
        this.catalogItemMapper = catalogItemMapper;
        this.offerMapper = offerMapper;
        this.offerBlockMapper = offerBlockMapper;
        this.blockLedgerService = blockLedgerService;
        this.participantService = participantService;
        this.trustEngine = trustEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public CatalogView getCatalog() {
        return getCatalog(null);
    }

    @Override
    public CatalogView getCatalog(FilterCriteria criteria) {
        // ==================== 1. 读取目录数据 ====================
        List<Provider> providers = providerMapper.selectList(
                new LambdaQueryWrapper<Provider>().orderByAsc(Provider::getId));
        List<CatalogItem> items = catalogItemMapper.selectList(
                new LambdaQueryWrapper<CatalogItem>().orderByAsc(CatalogItem::getId));
        List<Offer> offers = offerMapper.selectList(new LambdaQueryWrapper<Offer>()
                .eq(Offer::getStatus, OfferStatus.ACTIVE)
                .orderByAsc(Offer::getId));
        Map<String, Integer> availableByOffer = blockLedgerService.countAvailableByOffer();

        // ==================== 2. 组装 卖方 → 商品 → 报价 ====================
        Map<String, CatalogView.ItemEntry> itemEntries = new LinkedHashMap<>();
        Map<String, String> itemProvider = new LinkedHashMap<>();
        for (CatalogItem item : items) {
            if (!matchesItem(item, criteria)) {
                continue;
            }
            itemEntries.put(item.getId(), CatalogView.ItemEntry.builder()
                    .id(item.getId())
                    .sourceType(item.getSourceType() == null ? null : item.getSourceType().name())
                    .availableQty(item.getAvailableQty())
                    .meterId(item.getMeterId())
                    .productionWindows(readWindows(item))
                    .build());
            itemProvider.put(item.getId(), item.getProviderId());
        }
        for (Offer offer : offers) {
            CatalogView.ItemEntry itemEntry = itemEntries.get(offer.getItemId());
            if (itemEntry == null) {
                continue;
            }
            itemEntry.getOffers().add(CatalogView.OfferEntry.builder()
                    .id(offer.getId())
                    .itemId(offer.getItemId())
                    .providerId(offer.getProviderId())
                    .price(offer.getPriceValue() == null ? 0 : offer.getPriceValue())
                    .currency(offer.getCurrency())
                    .maxQuantity(availableByOffer.getOrDefault(offer.getId(), 0))
                    .timeWindow(TimeWindow.of(offer.getWindowStart(), offer.getWindowEnd()))
                    .pricingModel(offer.getPricingModel())
                    .settlementType(offer.getSettlementType())
                    .build());
        }

        CatalogView view = new CatalogView();
        for (Provider provider : providers) {
            CatalogView.ProviderEntry providerEntry = CatalogView.ProviderEntry.builder()
                    .id(provider.getId())
                    .name(provider.getName())
                    .trustScore(provider.getTrustScore())
                    .build();
            itemEntries.forEach((itemId, itemEntry) -> {
                if (provider.getId().equals(itemProvider.get(itemId))) {
                    providerEntry.getItems().add(itemEntry);
                }
            });
            boolean filtered = criteria != null && !criteria.isEmpty();
            if (!filtered || !providerEntry.getItems().isEmpty()) {
                view.getProviders().add(providerEntry);
            }
        }
        return view;
    }

    private boolean matchesItem(CatalogItem item, FilterCriteria criteria) {
        if (criteria == null) {
            return true;
        }
        if (criteria.getSourceType() != null
                && (item.getSourceType() == null || !item.getSourceType().name().equalsIgnoreCase(criteria.getSourceType()))) {
            return false;
        }
        if (criteria.getMinAvailableQuantity() != null
                && (item.getAvailableQty() == null || item.getAvailableQty() < criteria.getMinAvailableQuantity())) {
            return false;
        }
        if (criteria.getTimeWindow() != null) {
            List<TimeWindow> windows = readWindows(item);
            // 未声明发电时段的商品不按时段过滤
            return windows.isEmpty() || windows.stream().anyMatch(w -> w.overlaps(criteria.getTimeWindow()));
        }
        return true;
    }

    @Override
    public Offer getActiveOffer(String offerId) {
        Offer offer = offerId == null ? null : offerMapper.selectById(offerId);
        if (offer == null) {
            throw new ValidationException(ErrorCode.OFFER_NOT_FOUND, "Offer not found: " + offerId);
        }
        if (offer.getStatus() != OfferStatus.ACTIVE) {
            throw new ValidationException(ErrorCode.OFFER_NOT_FOUND, "Offer is not active: " + offerId);
        }
        return offer;
    }

    @Override
    public Provider getProvider(String providerId) {
        return providerId == null ? null : providerMapper.selectById(providerId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Provider syncProvider(Provider provider) {
        if (provider == null || isBlank(provider.getId())) {
            throw new ValidationException("Provider id is required");
        }
        LocalDateTime now = LocalDateTime.now();
        Provider existing = providerMapper.selectById(provider.getId());
        if (existing == null) {
            provider.setTrustScore(provider.getTrustScore() == null
                    ? trustEngine.getConfig().getDefaultScore()
                    : Math.max(0, Math.min(1, provider.getTrustScore())));
            provider.setTotalOrders(0);
            provider.setSuccessfulOrders(0);
            provider.setCreateTime(now);
            provider.setUpdateTime(now);
            providerMapper.insert(provider);
            log.info("[卖方同步-新增] providerId={}, trustScore={}, traceId={}",
                    provider.getId(), provider.getTrustScore(), TraceIdUtil.getTraceId());
            return provider;
        }
        // 信任分与统计只由信任引擎维护
        existing.setName(provider.getName() != null ? provider.getName() : existing.getName());
        existing.setUpdateTime(now);
        providerMapper.updateById(existing);
        log.info("[卖方同步-更新] providerId={}, traceId={}", existing.getId(), TraceIdUtil.getTraceId());
        return existing;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CatalogItem syncItem(CatalogItem item, List<TimeWindow> productionWindows) {
        if (item == null || isBlank(item.getId()) || isBlank(item.getProviderId())) {
            throw new ValidationException("Item id and providerId are required");
        }
        if (providerMapper.selectById(item.getProviderId()) == null) {
            throw new ValidationException(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + item.getProviderId());
        }
        if (item.getSourceType() == null) {
            item.setSourceType(SourceType.OTHER);
        }
        item.setProductionWindowsJson(writeWindows(productionWindows));

        LocalDateTime now = LocalDateTime.now();
        CatalogItem existing = catalogItemMapper.selectById(item.getId());
        item.setUpdateTime(now);
        if (existing == null) {
            item.setCreateTime(now);
            catalogItemMapper.insert(item);
            log.info("[商品同步-新增] itemId={}, providerId={}, sourceType={}, traceId={}",
                    item.getId(), item.getProviderId(), item.getSourceType(), TraceIdUtil.getTraceId());
        } else {
            item.setCreateTime(existing.getCreateTime());
            catalogItemMapper.updateById(item);
            log.info("[商品同步-更新] itemId={}, traceId={}", item.getId(), TraceIdUtil.getTraceId());
        }
        return item;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public OfferSyncResult syncOffer(Offer offer, boolean resyncBlocks) {
        // ==================== 1. 参数校验 ====================
        if (offer == null || isBlank(offer.getId()) || isBlank(offer.getItemId())) {
            throw new ValidationException("Offer id and itemId are required");
        }
        if (offer.getPriceValue() == null || offer.getPriceValue() < 0) {
            throw new ValidationException("Offer price must be non-negative");
        }
        if (offer.getWindowStart() != null && offer.getWindowEnd() != null
                && !offer.getWindowEnd().isAfter(offer.getWindowStart())) {
            throw new ValidationException("Offer time window end must be after start");
        }
        CatalogItem item = catalogItemMapper.selectById(offer.getItemId());
        if (item == null) {
            throw new ValidationException(ErrorCode.ITEM_NOT_FOUND, "Item not found: " + offer.getItemId());
        }
        if (offer.getProviderId() == null) {
            offer.setProviderId(item.getProviderId());
        } else if (!offer.getProviderId().equals(item.getProviderId())) {
            throw new ValidationException("Offer provider " + offer.getProviderId()
                    + " does not own item " + item.getId());
        }

        LocalDateTime now = LocalDateTime.now();
        Offer existing = offerMapper.selectById(offer.getId());

        // ==================== 2. 新报价：额度校验 + 创建区块 ====================
        if (existing == null) {
            if (offer.getMaxQty() == null || offer.getMaxQty() <= 0) {
                throw new ValidationException("New offer maxQty must be positive");
            }
            checkListingLimit(offer);
            offer.setStatus(OfferStatus.ACTIVE);
            offer.setCreateTime(now);
            offer.setUpdateTime(now);
            offerMapper.insert(offer);
            int created = blockLedgerService.materialize(offer);
            log.info("[报价同步-新增] offerId={}, itemId={}, maxQty={}, price={}, traceId={}",
                    offer.getId(), offer.getItemId(), offer.getMaxQty(), offer.getPriceValue(), TraceIdUtil.getTraceId());
            return OfferSyncResult.builder().offerId(offer.getId()).created(true).blocksCreated(created).build();
        }

        // ==================== 3. 已有报价：只更新描述字段 ====================
        if (offer.getMaxQty() != null && !offer.getMaxQty().equals(existing.getMaxQty())) {
            log.warn("[报价同步] maxQty变更不会增删区块，offerId={}, maxQty={}->{}, traceId={}",
                    offer.getId(), existing.getMaxQty(), offer.getMaxQty(), TraceIdUtil.getTraceId());
        }
        offer.setStatus(existing.getStatus());
        offer.setCreateTime(existing.getCreateTime());
        offer.setUpdateTime(now);
        offerMapper.updateById(offer);

        int resynced = resyncBlocks ? blockLedgerService.resyncSnapshots(offer) : 0;
        log.info("[报价同步-更新] offerId={}, resyncBlocks={}, resynced={}, traceId={}",
                offer.getId(), resyncBlocks, resynced, TraceIdUtil.getTraceId());
        return OfferSyncResult.builder().offerId(offer.getId()).created(false).blocksResynced(resynced).build();
    }

    /**
     * 卖方上架额度：未售出区块 + 新上架数量 不得超过 申报容量 × 信任档位比例
     */
    private void checkListingLimit(Offer offer) {
        Participant seller = participantService.findByProviderId(offer.getProviderId());
        if (seller == null || seller.getDeclaredCapacity() == null || seller.getDeclaredCapacity() <= 0) {
            return;
        }
        Provider provider = providerMapper.selectById(offer.getProviderId());
        double trustScore = provider == null || provider.getTrustScore() == null
                ? trustEngine.getConfig().getDefaultScore() : provider.getTrustScore();
        double allowed = trustEngine.allowedTradeQuantity(seller.getDeclaredCapacity(), trustScore);
        long open = offerBlockMapper.countOpenBlocksByProvider(offer.getProviderId());
        if (open + offer.getMaxQty() > allowed) {
            log.warn("[上架额度不足] providerId={}, open={}, requested={}, allowed={}, traceId={}",
                    offer.getProviderId(), open, offer.getMaxQty(), allowed, TraceIdUtil.getTraceId());
            throw new ValidationException(ErrorCode.TRADE_LIMIT_EXCEEDED,
                    "Listing " + offer.getMaxQty() + " exceeds trade limit " + allowed
                            + " (open " + open + ") for provider " + offer.getProviderId());
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public OfferDeletion deleteOffer(String offerId) {
        Offer offer = offerId == null ? null : offerMapper.selectByIdForUpdate(offerId);
        if (offer == null) {
            log.info("[报价删除] 报价不存在，offerId={}, traceId={}", offerId, TraceIdUtil.getTraceId());
            return OfferDeletion.ABSENT;
        }

        // ==================== 1. 先下架，新的预留不再命中该报价 ====================
        offer.setStatus(OfferStatus.DISABLED);
        offer.setUpdateTime(LocalDateTime.now());
        offerMapper.updateById(offer);

        BlockStats stats = blockLedgerService.getBlockStats(offerId);
        if (stats.getReserved() + stats.getSold() > 0) {
            log.warn("[报价软删除] 存在在途区块，offerId={}, reserved={}, sold={}, traceId={}",
                    offerId, stats.getReserved(), stats.getSold(), TraceIdUtil.getTraceId());
            return OfferDeletion.DISABLED;
        }

        // ==================== 2. 只删除AVAILABLE区块 ====================
        int deletedBlocks = blockLedgerService.deleteAvailableByOffer(offerId);
        long remaining = blockLedgerService.getBlockStats(offerId).getTotal();
        if (remaining > 0) {
            // 读取统计后有预留抢先提交，在途区块保留
            log.warn("[报价软删除] 删除期间出现在途区块，offerId={}, deletedBlocks={}, remaining={}, traceId={}",
                    offerId, deletedBlocks, remaining, TraceIdUtil.getTraceId());
            return OfferDeletion.DISABLED;
        }

        // ==================== 3. 删除报价 ====================
        offerMapper.deleteById(offerId);
        log.info("[报价删除] offerId={}, deletedBlocks={}, traceId={}", offerId, deletedBlocks, TraceIdUtil.getTraceId());
        return OfferDeletion.DELETED;
    }

    private List<TimeWindow> readWindows(CatalogItem item) {
        if (isBlank(item.getProductionWindowsJson())) {
            return new ArrayList<>();
        }
        try {
            List<TimeWindow> windows = objectMapper.readValue(item.getProductionWindowsJson(), WINDOW_LIST);
            windows.sort(Comparator.comparing(TimeWindow::getStartTime, Comparator.nullsLast(Comparator.naturalOrder())));
            return windows;
        } catch (JsonProcessingException e) {
            log.warn("[发电时段解析失败] itemId={}, errorMsg={}", item.getId(), e.getMessage());
            return new ArrayList<>();
        }
    }

    private String writeWindows(List<TimeWindow> windows) {
        if (windows == null || windows.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(windows);
        } catch (JsonProcessingException e) {
            throw new TradeException(ErrorCode.INTERNAL_ERROR, "Cannot serialize production windows", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
