package org.energytrade.service;

import org.energytrade.domain.CatalogItem;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferDeletion;
import org.energytrade.domain.OfferSyncResult;
import org.energytrade.domain.Provider;
import org.energytrade.engine.FilterCriteria;
import org.energytrade.engine.TimeWindow;
import org.energytrade.protocol.CatalogView;

import java.util.List;

/**
 * 目录服务
 * - 组装 卖方 → 商品 → 报价 视图，报价数量取实时AVAILABLE区块数
 * - 接收卖方侧同步（按ID幂等）
 */
public interface ICatalogService {

    CatalogView getCatalog();

    /**
     * 按能源类型、最小供电量、发电时段过滤后的目录
     */
    CatalogView getCatalog(FilterCriteria criteria);

    /**
     * @throws org.energytrade.exception.ValidationException 报价不存在或已下架
     */
    Offer getActiveOffer(String offerId);

    Provider getProvider(String providerId);

    Provider syncProvider(Provider provider);

    CatalogItem syncItem(CatalogItem item, List<TimeWindow> productionWindows);

    /**
     * 新报价会创建区块；已有报价只更新描述字段
     *
     * @param resyncBlocks true 时刷新AVAILABLE区块的价格/时间快照
     */
    OfferSyncResult syncOffer(Offer offer, boolean resyncBlocks);

    /**
     * 只有全部区块都是AVAILABLE时才级联删除，否则软删除
     */
    OfferDeletion deleteOffer(String offerId);
}
