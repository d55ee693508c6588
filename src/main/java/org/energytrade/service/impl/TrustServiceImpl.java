package org.energytrade.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.Participant;
import org.energytrade.domain.Provider;
import org.energytrade.domain.TrustChangeReason;
import org.energytrade.domain.TrustScoreHistory;
import org.energytrade.domain.TrustSubjectType;
import org.energytrade.engine.TrustEngine;
import org.energytrade.engine.TrustUpdate;
import org.energytrade.engine.VerificationQuality;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.ParticipantMapper;
import org.energytrade.mapper.ProviderMapper;
import org.energytrade.mapper.TrustScoreHistoryMapper;
import org.energytrade.service.ITrustService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.function.Function;

/**
 * 信任分落库实现
 * - 事务内 SELECT ... FOR UPDATE 锁住主体行再读改写，锁持有到提交
 * - 每次变更写一条 trust_score_history
 */
@Slf4j
@Service
public class TrustServiceImpl implements ITrustService {

    private final TrustEngine trustEngine;
    private final ProviderMapper providerMapper;
    private final ParticipantMapper participantMapper;
    private final TrustScoreHistoryMapper trustScoreHistoryMapper;

    public TrustServiceImpl(TrustEngine trustEngine,
                            ProviderMapper providerMapper,
                            ParticipantMapper participantMapper,
                            TrustScoreHistoryMapper trustScoreHistoryMapper) {
        this.trustEngine = trustEngine;
        this.providerMapper = providerMapper;
        this.participantMapper = participantMapper;
        this.trustScoreHistoryMapper = trustScoreHistoryMapper;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public TrustUpdate applyDeliveryOutcome(String providerId, String orderId, double deliveredQty, double expectedQty) {
        Provider provider = lockProvider(providerId);
        TrustUpdate update = trustEngine.updateAfterDelivery(scoreOf(provider), deliveredQty, expectedQty);

        int totalOrders = provider.getTotalOrders() == null ? 0 : provider.getTotalOrders();
        int successfulOrders = provider.getSuccessfulOrders() == null ? 0 : provider.getSuccessfulOrders();
        provider.setTotalOrders(totalOrders + 1);
        if (expectedQty > 0 && deliveredQty >= expectedQty) {
            provider.setSuccessfulOrders(successfulOrders + 1);
        }
        provider.setTrustScore(update.getNewScore());
        provider.setUpdateTime(LocalDateTime.now());
        providerMapper.updateById(provider);

        recordHistory(TrustSubjectType.PROVIDER, providerId, update, TrustChangeReason.DELIVERY, orderId);
        log.info("[交付信任更新] providerId={}, orderId={}, delivered={}, expected={}, score={}->{}, traceId={}",
                providerId, orderId, deliveredQty, expectedQty,
                update.getPreviousScore(), update.getNewScore(), TraceIdUtil.getTraceId());
        return update;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public TrustUpdate applyBuyerCancel(String buyerId, String orderId, double cancelledQty, double totalQty,
                                        boolean withinCancelWindow) {
        return updateParticipant(buyerId, orderId, TrustChangeReason.BUYER_CANCEL,
                score -> trustEngine.updateAfterCancel(score, cancelledQty, totalQty, withinCancelWindow));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public TrustUpdate applySellerCancel(String providerId, String orderId, double cancelledQty, double totalQty) {
        Provider provider = lockProvider(providerId);
        TrustUpdate update = trustEngine.updateAfterSellerCancel(scoreOf(provider), cancelledQty, totalQty);
        provider.setTrustScore(update.getNewScore());
        provider.setUpdateTime(LocalDateTime.now());
        providerMapper.updateById(provider);

        recordHistory(TrustSubjectType.PROVIDER, providerId, update, TrustChangeReason.SELLER_CANCEL, orderId);
        log.info("[卖方取消信任更新] providerId={}, orderId={}, score={}->{}, traceId={}",
                providerId, orderId, update.getPreviousScore(), update.getNewScore(), TraceIdUtil.getTraceId());
        return update;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public TrustUpdate applyVerification(String participantId, Double verifiedCapacity) {
        Participant participant = participantMapper.selectByIdForUpdate(participantId);
        if (participant == null) {
            throw new ValidationException(ErrorCode.PARTICIPANT_NOT_FOUND, "Participant not found: " + participantId);
        }
        // 入驻加分只生效一次
        if (participant.getVerifiedAt() != null) {
            log.warn("[入驻核验重复] participantId={}, quality={}, traceId={}",
                    participantId, participant.getVerificationQuality(), TraceIdUtil.getTraceId());
            double score = scoreOf(participant);
            return TrustUpdate.builder()
                    .previousScore(score)
                    .newScore(score)
                    .newLimit(trustEngine.allowedLimit(score))
                    .trustImpact(0)
                    .build();
        }
        VerificationQuality quality = VerificationQuality.fromCapacity(verifiedCapacity, participant.getDeclaredCapacity());
        TrustUpdate update = trustEngine.updateAfterVerificationQuality(scoreOf(participant), quality);

        participant.setVerificationQuality(quality);
        participant.setVerifiedAt(LocalDateTime.now());
        applyToParticipant(participant, update);
        recordHistory(TrustSubjectType.PARTICIPANT, participantId, update, TrustChangeReason.VERIFICATION, null);
        log.info("[入驻核验信任更新] participantId={}, quality={}, score={}->{}, traceId={}",
                participantId, quality, update.getPreviousScore(), update.getNewScore(), TraceIdUtil.getTraceId());
        return update;
    }

    private TrustUpdate updateParticipant(String participantId, String orderId, TrustChangeReason reason,
                                          Function<Double, TrustUpdate> calculation) {
        Participant participant = participantMapper.selectByIdForUpdate(participantId);
        if (participant == null) {
            log.warn("[信任更新跳过] 参与方不存在，participantId={}, reason={}, orderId={}, traceId={}",
                    participantId, reason, orderId, TraceIdUtil.getTraceId());
            return null;
        }
        TrustUpdate update = calculation.apply(scoreOf(participant));
        if (update.getTrustImpact() == 0) {
            return update;
        }
        applyToParticipant(participant, update);
        recordHistory(TrustSubjectType.PARTICIPANT, participantId, update, reason, orderId);
        log.info("[参与方信任更新] participantId={}, reason={}, orderId={}, score={}->{}, traceId={}",
                participantId, reason, orderId, update.getPreviousScore(), update.getNewScore(),
                TraceIdUtil.getTraceId());
        return update;
    }

    private void applyToParticipant(Participant participant, TrustUpdate update) {
        participant.setTrustScore(update.getNewScore());
        participant.setAllowedLimit(update.getNewLimit());
        participant.setUpdateTime(LocalDateTime.now());
        participantMapper.updateById(participant);
    }

    private void recordHistory(TrustSubjectType subjectType, String subjectId, TrustUpdate update,
                               TrustChangeReason reason, String orderId) {
        trustScoreHistoryMapper.insert(TrustScoreHistory.builder()
                .subjectType(subjectType)
                .subjectId(subjectId)
                .previousScore(update.getPreviousScore())
                .newScore(update.getNewScore())
                .previousLimit(trustEngine.allowedLimit(update.getPreviousScore()))
                .newLimit(update.getNewLimit())
                .trustImpact(update.getTrustImpact())
                .reason(reason)
                .orderId(orderId)
                .createTime(LocalDateTime.now())
                .build());
    }

    private Provider lockProvider(String providerId) {
        Provider provider = providerId == null ? null : providerMapper.selectByIdForUpdate(providerId);
        if (provider == null) {
            throw new ValidationException(ErrorCode.PROVIDER_NOT_FOUND, "Provider not found: " + providerId);
        }
        return provider;
    }

    private double scoreOf(Provider provider) {
        return provider.getTrustScore() == null ? trustEngine.getConfig().getDefaultScore() : provider.getTrustScore();
    }

    private double scoreOf(Participant participant) {
        return participant.getTrustScore() == null ? trustEngine.getConfig().getDefaultScore() : participant.getTrustScore();
    }
}
