package com.smsgate.web;

import com.smsgate.MutableClock;
import com.smsgate.dispatch.ConsentDeniedException;
import com.smsgate.dispatch.DispatchCoordinator;
import com.smsgate.dispatch.OutboundSendRequest;
import com.smsgate.dispatch.RateLimitExceededException;
import com.smsgate.dispatch.SendResult;
import com.smsgate.gateway.GatewayException;
import com.smsgate.message.Message;
import com.smsgate.message.MessageCategory;
import com.smsgate.message.MessageDirection;
import com.smsgate.message.MessageRepository;
import com.smsgate.message.MessageStatus;
import com.smsgate.message.MessageType;
import com.smsgate.ratelimit.LimitType;
import com.smsgate.ratelimit.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MessageApiControllerTest {

    private static final String BODY = """
            {"to":"+14155238886","from":"+16502530000","content":"Spring sale","category":"MARKETING"}
            """;

    @Mock private DispatchCoordinator dispatchCoordinator;
    @Mock private MessageRepository messageRepository;

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MessageApiController(dispatchCoordinator, messageRepository))
                .setControllerAdvice(new ApiExceptionHandler(clock))
                .build();
    }

    @Test
    void sendIsAccepted() throws Exception {
        UUID id = UUID.randomUUID();
        when(dispatchCoordinator.sendOutbound(any()))
                .thenReturn(new SendResult(id, MessageStatus.SENT, "SM100", 0, false, false));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.messageId").value(id.toString()))
                .andExpect(jsonPath("$.status").value("SENT"))
                .andExpect(jsonPath("$.externalId").value("SM100"));

        ArgumentCaptor<OutboundSendRequest> request = ArgumentCaptor.forClass(OutboundSendRequest.class);
        verify(dispatchCoordinator).sendOutbound(request.capture());
        assertEquals("tenant-1", request.getValue().tenantId());
        assertEquals(MessageType.SMS, request.getValue().messageType());
        assertEquals(MessageCategory.MARKETING, request.getValue().category());
    }

    @Test
    void rateLimitedSendReturns429WithRetryAfter() throws Exception {
        when(dispatchCoordinator.sendOutbound(any()))
                .thenThrow(new RateLimitExceededException(LimitType.MINUTE, clock.instant().plusSeconds(42), 5));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.error").value("rate_limit_exceeded"))
                .andExpect(jsonPath("$.window").value("minute"))
                .andExpect(jsonPath("$.limit").value(5))
                .andExpect(jsonPath("$.resetTime").value("2026-03-01T10:00:42Z"));
    }

    @Test
    void consentDenialIsForbidden() throws Exception {
        when(dispatchCoordinator.sendOutbound(any()))
                .thenThrow(new ConsentDeniedException(MessageCategory.MARKETING, "No valid marketing consent"));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("consent_denied"))
                .andExpect(jsonPath("$.category").value("MARKETING"));
    }

    @Test
    void exhaustedGatewayIsBadGateway() throws Exception {
        when(dispatchCoordinator.sendOutbound(any()))
                .thenThrow(new GatewayException("30003", "Unreachable"));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("30003"));
    }

    @Test
    void concurrentUpdateIsConflict() throws Exception {
        when(dispatchCoordinator.sendOutbound(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(Message.class, UUID.randomUUID()));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("concurrent_update"));
    }

    @Test
    void storeOutageIsServiceUnavailable() throws Exception {
        when(dispatchCoordinator.sendOutbound(any())).thenThrow(new StoreUnavailableException("down"));

        mockMvc.perform(post("/api/tenants/tenant-1/messages")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("store_unavailable"));
    }

    @Test
    void getReturnsMessageView() throws Exception {
        Message message = new Message("tenant-1", MessageDirection.OUTBOUND, MessageType.SMS,
                "+16502530000", "+14155238886", "hi");
        UUID id = UUID.randomUUID();
        message.setId(id);
        message.setExternalId("SM100");
        when(messageRepository.findByIdAndTenantId(id, "tenant-1")).thenReturn(Optional.of(message));

        mockMvc.perform(get("/api/tenants/tenant-1/messages/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.direction").value("OUTBOUND"))
                .andExpect(jsonPath("$.externalId").value("SM100"));
    }

    @Test
    void getOtherTenantsMessageIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(messageRepository.findByIdAndTenantId(id, "tenant-2")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tenants/tenant-2/messages/" + id))
                .andExpect(status().isNotFound());
    }

    @Test
    void retryRunsDispatchForExistingMessage() throws Exception {
        UUID id = UUID.randomUUID();
        when(dispatchCoordinator.retry("tenant-1", id))
                .thenReturn(new SendResult(id, MessageStatus.SENT, "SM200", 1, false, false));

        mockMvc.perform(post("/api/tenants/tenant-1/messages/" + id + "/retry"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.externalId").value("SM200"));

        verify(dispatchCoordinator).retry("tenant-1", id);
    }
}
