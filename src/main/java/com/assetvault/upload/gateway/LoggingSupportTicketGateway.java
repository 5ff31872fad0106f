package com.assetvault.upload.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
public class LoggingSupportTicketGateway implements SupportTicketGateway {

    @Override
    public String openTicket(UploadFailureSummary summary) {
        String reference = "UPL-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        log.warn("Support ticket {} opened for upload session={}, tenant={}, failures={}, reason={}: {}",
                reference, summary.uploadSessionId(), summary.tenantId(), summary.failureCount(),
                summary.failureReason(), summary.message());
        return reference;
    }
}
