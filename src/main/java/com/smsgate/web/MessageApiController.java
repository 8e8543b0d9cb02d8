package com.smsgate.web;

import com.smsgate.dispatch.DispatchCoordinator;
import com.smsgate.dispatch.OutboundSendRequest;
import com.smsgate.dispatch.SendResult;
import com.smsgate.message.Message;
import com.smsgate.message.MessageCategory;
import com.smsgate.message.MessageNotFoundException;
import com.smsgate.message.MessageRepository;
import com.smsgate.message.MessageType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/tenants/{tenantId}/messages")
public class MessageApiController {

    private final DispatchCoordinator dispatchCoordinator;
    private final MessageRepository messageRepository;

    public MessageApiController(DispatchCoordinator dispatchCoordinator,
                                MessageRepository messageRepository) {
        this.dispatchCoordinator = dispatchCoordinator;
        this.messageRepository = messageRepository;
    }

    @PostMapping
    public ResponseEntity<SendResult> send(@PathVariable String tenantId,
                                           @RequestBody SendMessageRequest request) {
        SendResult result = dispatchCoordinator.sendOutbound(new OutboundSendRequest(
                tenantId,
                request.to(),
                request.from(),
                request.content(),
                request.contactId(),
                request.messageType() != null ? request.messageType() : MessageType.SMS,
                request.category()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @PostMapping("/{messageId}/retry")
    public ResponseEntity<SendResult> retry(@PathVariable String tenantId, @PathVariable UUID messageId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(dispatchCoordinator.retry(tenantId, messageId));
    }

    @GetMapping("/{messageId}")
    public MessageView get(@PathVariable String tenantId, @PathVariable UUID messageId) {
        return messageRepository.findByIdAndTenantId(messageId, tenantId)
                .map(MessageView::from)
                .orElseThrow(() -> new MessageNotFoundException(tenantId, messageId.toString()));
    }

    public record SendMessageRequest(String to, String from, String content, String contactId,
                                     MessageType messageType, MessageCategory category) {}

    public record MessageView(UUID id, String direction, String channel, String status,
                              String from, String to, String externalId, int retryCount,
                              String errorCode, String errorMessage,
                              Instant createdAt, Instant updatedAt, Instant deliveredAt) {
        static MessageView from(Message m) {
            return new MessageView(m.getId(), m.getDirection().name(), m.getChannel().name(),
                    m.getStatus().name(), m.getFromAddress(), m.getToAddress(), m.getExternalId(),
                    m.getRetryCount(), m.getErrorCode(), m.getErrorMessage(),
                    m.getCreatedAt(), m.getUpdatedAt(), m.getDeliveredAt());
        }
    }
}
