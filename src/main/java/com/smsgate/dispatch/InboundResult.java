package com.smsgate.dispatch;

import java.util.UUID;

public record InboundResult(UUID messageId, boolean duplicate, boolean contactMatched) {}
