package org.energytrade.controller;

import lombok.Data;
import org.energytrade.domain.Participant;
import org.energytrade.engine.TrustEngine;
import org.energytrade.engine.TrustTier;
import org.energytrade.engine.TrustUpdate;
import org.energytrade.service.IParticipantService;
import org.energytrade.service.ITrustService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 参与方信任信息
 */
@RestController
@RequestMapping("/api/participants")
public class ParticipantController {

    private final IParticipantService participantService;
    private final ITrustService trustService;
    private final TrustEngine trustEngine;

    public ParticipantController(IParticipantService participantService,
                                 ITrustService trustService,
                                 TrustEngine trustEngine) {
        this.participantService = participantService;
        this.trustService = trustService;
        this.trustEngine = trustEngine;
    }

    /**
     * 入驻核验，只生效一次
     */
    @PostMapping("/{participantId}/verification")
    public ResponseEntity<Map<String, Object>> verify(@PathVariable String participantId,
                                                      @RequestBody VerificationRequest request) {
        TrustUpdate update = trustService.applyVerification(participantId, request.getVerifiedCapacity());
        Map<String, Object> data = trustView(participantService.getRequired(participantId));
        data.put("trustImpact", update.getTrustImpact());
        return ApiResponse.ok("Verification processed", data);
    }

    @GetMapping("/{participantId}/trust")
    public ResponseEntity<Map<String, Object>> trust(@PathVariable String participantId) {
        return ApiResponse.ok("OK", trustView(participantService.getRequired(participantId)));
    }

    private Map<String, Object> trustView(Participant participant) {
        double score = participant.getTrustScore() == null
                ? trustEngine.getConfig().getDefaultScore() : participant.getTrustScore();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("participantId", participant.getId());
        data.put("trustScore", score);
        data.put("allowedLimit", trustEngine.allowedLimit(score));
        data.put("tier", TrustTier.of(score));
        data.put("tierDescription", trustEngine.tierDescription(score));
        data.put("nextTierProgress", trustEngine.nextTierProgress(score));
        data.put("verificationQuality", participant.getVerificationQuality());
        return data;
    }

    @Data
    public static class VerificationRequest {
        private Double verifiedCapacity;
    }
}
