package org.energytrade.controller;

import org.energytrade.business.ConfirmedOrder;
import org.energytrade.business.OrderDraft;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.domain.Offer;
import org.energytrade.domain.Participant;
import org.energytrade.support.IntegrationTestSupport;
import org.energytrade.util.IdempotencyKeyUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 买卖方订单接口与交付核验接口
 */
class OrderControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OrderLifecycleService orderLifecycleService;

    private String confirmOrder(Offer offer, Participant buyer, int quantity) {
        ConfirmedOrder confirmed = orderLifecycleService.confirmOrder(OrderDraft.builder()
                .transactionId(randomId("txn"))
                .buyerId(buyer.getId())
                .providerId(offer.getProviderId())
                .offerId(offer.getId())
                .itemId(offer.getItemId())
                .quantity(quantity)
                .totalPrice(offer.getPriceValue() * quantity)
                .currency(offer.getCurrency())
                .deliveryStart(offer.getWindowStart())
                .deliveryEnd(offer.getWindowEnd())
                .build());
        return confirmed.getOrder().getId();
    }

    @Test
    @DisplayName("带幂等键的取消重试返回缓存结果")
    void buyerCancelReplaysWithIdempotencyKey() throws Exception {
        Offer offer = seedOffer(5, 2.0);
        Participant buyer = seedBuyer(100);
        String orderId = confirmOrder(offer, buyer, 2);
        String body = "{\"buyer_id\":\"" + buyer.getId() + "\",\"reason\":\"changed mind\"}";

        mockMvc.perform(post("/api/buyer/orders/" + orderId + "/cancel")
                        .header("X-Idempotency-Key", "retry-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status", is("CANCELLED")));

        mockMvc.perform(post("/api/buyer/orders/" + orderId + "/cancel")
                        .header("X-Idempotency-Key", "retry-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(header().string(IdempotencyKeyUtil.REPLAY_HEADER, "true"))
                .andExpect(jsonPath("$.data.status", is("CANCELLED")));

        // 没有幂等键的重复取消命中状态机
        mockMvc.perform(post("/api/buyer/orders/" + orderId + "/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("40903")))
                .andExpect(jsonPath("$.data.currentState", is("CANCELLED")));
    }

    @Test
    @DisplayName("卖方推进交付，核验后订单完成")
    void sellerDeliveryThenVerification() throws Exception {
        Offer offer = seedOffer(5, 2.0);
        Participant buyer = seedBuyer(100);
        String orderId = confirmOrder(offer, buyer, 3);

        mockMvc.perform(post("/api/seller/orders/" + orderId + "/start-delivery"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status", is("DELIVERING")));
        mockMvc.perform(post("/api/seller/orders/" + orderId + "/delivered"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status", is("DELIVERED")));

        mockMvc.perform(post("/api/verification/delivery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"order_id\":\"" + orderId + "\",\"delivered_qty\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status", is("COMPLETED")))
                .andExpect(jsonPath("$.data.delivery_verified", is(true)));

        mockMvc.perform(get("/api/buyer/orders/" + orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.delivered_qty", closeTo(3.0, 1e-9)));
    }

    @Test
    @DisplayName("订单不存在返回404")
    void unknownOrder() throws Exception {
        mockMvc.perform(get("/api/buyer/orders/missing-order"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("40403")));
    }

    @Test
    @DisplayName("入驻核验只加一次分")
    void participantVerificationAppliesOnce() throws Exception {
        Participant participant = participantService.register(Participant.builder()
                .id(randomId("user"))
                .declaredCapacity(100.0)
                .balance(0.0)
                .build());

        mockMvc.perform(post("/api/participants/" + participant.getId() + "/verification")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verified_capacity\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trustScore", closeTo(0.32, 1e-9)))
                .andExpect(jsonPath("$.data.trustImpact", closeTo(0.02, 1e-9)));

        mockMvc.perform(post("/api/participants/" + participant.getId() + "/verification")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"verified_capacity\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trustImpact", closeTo(0.0, 1e-9)));

        mockMvc.perform(get("/api/participants/" + participant.getId() + "/trust"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tier", is("STARTER")))
                .andExpect(jsonPath("$.data.allowedLimit", is(20)));
    }
}
