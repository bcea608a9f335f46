package com.flagship.escrow_engine.gateway;

import lombok.Value;

@Value
public class GatewayRefund {
    String refundId;
}
