package org.energytrade.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.AuthenticatedPrincipal;
import org.energytrade.domain.Participant;
import org.energytrade.engine.TrustEngine;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.ParticipantMapper;
import org.energytrade.service.IParticipantService;
import org.energytrade.service.IPrincipalLookup;
import org.energytrade.service.IWalletService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 参与方服务
 * 同时作为主体查询和钱包校验的默认实现（基于 participants 表）
 */
@Slf4j
@Service
public class ParticipantServiceImpl extends ServiceImpl<ParticipantMapper, Participant>
        implements IParticipantService, IPrincipalLookup, IWalletService {

    private final TrustEngine trustEngine;

    public ParticipantServiceImpl(TrustEngine trustEngine) {
        this.trustEngine = trustEngine;
    }

    @Override
    public Participant getRequired(String participantId) {
        Participant participant = participantId == null ? null : getById(participantId);
        if (participant == null) {
            throw new ValidationException(ErrorCode.PARTICIPANT_NOT_FOUND, "Participant not found: " + participantId);
        }
        return participant;
    }

    @Override
    public Participant findByProviderId(String providerId) {
        if (providerId == null) {
            return null;
        }
        return lambdaQuery().eq(Participant::getProviderId, providerId).last("LIMIT 1").one();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Participant register(Participant participant) {
        if (participant.getId() == null || participant.getId().isBlank()) {
            throw new ValidationException("Participant id is required");
        }
        LocalDateTime now = LocalDateTime.now();
        Participant existing = getById(participant.getId());
        if (existing == null) {
            double score = participant.getTrustScore() != null
                    ? participant.getTrustScore()
                    : trustEngine.getConfig().getDefaultScore();
            participant.setTrustScore(score);
            participant.setAllowedLimit(trustEngine.allowedLimit(score));
            participant.setBalance(participant.getBalance() == null ? 0.0 : participant.getBalance());
            participant.setDeclaredCapacity(participant.getDeclaredCapacity() == null ? 0.0 : participant.getDeclaredCapacity());
            participant.setCreateTime(now);
            participant.setUpdateTime(now);
            save(participant);
            log.info("[参与方注册] participantId={}, trustScore={}, traceId={}",
                    participant.getId(), score, TraceIdUtil.getTraceId());
            return participant;
        }
        // 信任分只由信任引擎修改，这里只更新资料字段
        if (participant.getName() != null) {
            existing.setName(participant.getName());
        }
        if (participant.getDeclaredCapacity() != null) {
            existing.setDeclaredCapacity(participant.getDeclaredCapacity());
        }
        if (participant.getProviderId() != null) {
            existing.setProviderId(participant.getProviderId());
        }
        if (participant.getBalance() != null) {
            existing.setBalance(participant.getBalance());
        }
        existing.setUpdateTime(now);
        updateById(existing);
        return existing;
    }

    // ==================== 主体查询 ====================

    @Override
    public Optional<AuthenticatedPrincipal> findPrincipal(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        Participant participant = getById(userId);
        if (participant == null) {
            return Optional.empty();
        }
        return Optional.of(AuthenticatedPrincipal.builder()
                .userId(participant.getId())
                .trustScore(participant.getTrustScore() == null
                        ? trustEngine.getConfig().getDefaultScore() : participant.getTrustScore())
                .declaredCapacity(participant.getDeclaredCapacity() == null ? 0 : participant.getDeclaredCapacity())
                .providerId(participant.getProviderId())
                .build());
    }

    // ==================== 钱包校验 ====================

    @Override
    public boolean hasSufficientFunds(String userId, double amount) {
        Participant participant = userId == null ? null : getById(userId);
        if (participant == null || participant.getBalance() == null) {
            return false;
        }
        return participant.getBalance() >= amount;
    }
}
