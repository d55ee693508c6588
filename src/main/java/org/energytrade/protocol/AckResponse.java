package org.energytrade.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 同步应答：ACK 或 NACK
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AckResponse {

    public static final String ACK = "ACK";
    public static final String NACK = "NACK";

    private ProtocolContext context;
    private AckMessage message;
    private ProtocolError error;

    public static AckResponse ack(ProtocolContext context) {
        return new AckResponse(context, new AckMessage(new Ack(ACK)), null);
    }

    public static AckResponse nack(ProtocolContext context, String code, String errorMessage) {
        return new AckResponse(context, new AckMessage(new Ack(NACK)), new ProtocolError(code, errorMessage));
    }

    @JsonIgnore
    public boolean isAck() {
        return message != null && message.getAck() != null && ACK.equals(message.getAck().getStatus());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AckMessage {
        private Ack ack;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Ack {
        private String status;
    }
}
