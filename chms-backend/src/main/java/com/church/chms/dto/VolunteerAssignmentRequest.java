package com.church.chms.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量分配志愿者：任何一项无效则整批回滚
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VolunteerAssignmentRequest {

    @NotEmpty(message = "volunteers list is required")
    @Valid
    private List<Entry> volunteers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        @NotNull(message = "memberId is required")
        private Long memberId;

        private Long roleId;

        @Size(max = 500, message = "notes must be at most 500 characters")
        private String notes;
    }
}
