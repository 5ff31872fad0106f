package com.assetvault.upload.gateway;

public interface SupportTicketGateway {

    /**
     * @return reference of the opened ticket
     */
    String openTicket(UploadFailureSummary summary);
}
