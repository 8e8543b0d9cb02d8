package com.smsgate.web;

import com.smsgate.dispatch.DispatchCoordinator;
import com.smsgate.dispatch.InboundResult;
import com.smsgate.dispatch.InboundSmsPayload;
import com.smsgate.message.DeliveryStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives carrier webhooks: inbound messages and delivery status callbacks.
 * Parameter names follow Twilio's form encoding.
 */
@RestController
@RequestMapping("/webhooks/sms/{tenantId}")
public class SmsWebhookController {

    private static final Logger log = LoggerFactory.getLogger(SmsWebhookController.class);

    private final DispatchCoordinator dispatchCoordinator;
    private final DeliveryStatusUpdater deliveryStatusUpdater;

    public SmsWebhookController(DispatchCoordinator dispatchCoordinator,
                                DeliveryStatusUpdater deliveryStatusUpdater) {
        this.dispatchCoordinator = dispatchCoordinator;
        this.deliveryStatusUpdater = deliveryStatusUpdater;
    }

    @PostMapping(value = "/incoming", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Map<String, Object>> incoming(@PathVariable String tenantId,
                                                        @RequestParam Map<String, String> params) {
        String smsStatus = params.get("SmsStatus");
        if (smsStatus != null && !"received".equalsIgnoreCase(smsStatus)) {
            log.debug("Ignoring inbound webhook with SmsStatus={}", smsStatus);
            return ResponseEntity.ok(Map.of("ignored", true));
        }

        InboundResult result = dispatchCoordinator.receiveInbound(new InboundSmsPayload(
                params.get("MessageSid"), params.get("From"), params.get("To"), params.get("Body"), tenantId));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messageId", result.messageId());
        body.put("duplicate", result.duplicate());
        body.put("contactMatched", result.contactMatched());
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/status", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<DeliveryStatusUpdater.StatusUpdate> status(@PathVariable String tenantId,
                                                                     @RequestParam("MessageSid") String messageSid,
                                                                     @RequestParam("MessageStatus") String messageStatus,
                                                                     @RequestParam(value = "ErrorCode", required = false) String errorCode,
                                                                     @RequestParam(value = "ErrorMessage", required = false) String errorMessage) {
        return ResponseEntity.ok(deliveryStatusUpdater.apply(tenantId, messageSid, messageStatus, errorCode, errorMessage));
    }
}
