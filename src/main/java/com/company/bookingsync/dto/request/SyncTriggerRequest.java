package com.company.bookingsync.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncTriggerRequest {

    @Pattern(regexp = "(?i)incremental|deep|default", message = "mode must be incremental, deep or default")
    private String mode;

    private String tenantId;

    @Min(value = 1, message = "daysBack must be at least 1")
    @Max(value = 365, message = "daysBack must be at most 365")
    private Integer daysBack;

    // Defaults to calendly
    private String provider;
}
