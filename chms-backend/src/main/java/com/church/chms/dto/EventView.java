package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class EventView {

    private Long eventId;
    private String eventTitle;
    private String eventDescription;
    private LocalDate eventDate;
    private String location;
    private Long branchId;
    private String branchName;
    private Long createdBy;
    private String creatorName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
