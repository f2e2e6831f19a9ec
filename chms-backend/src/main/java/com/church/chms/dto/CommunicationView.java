package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class CommunicationView {

    private Long communicationId;
    private String title;
    private String message;
    private Long sentBy;
    private String senderName;
    private Long targetGroupId;
    private Long targetMemberId;
    private LocalDateTime createdAt;
}
