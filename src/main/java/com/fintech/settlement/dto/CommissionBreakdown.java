package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommissionBreakdown {

    private UUID settlementId;
    private LocalDate settlementDate;

    @Builder.Default
    private List<RecipientCommission> delegateBreakdown = new ArrayList<>();

    @Builder.Default
    private List<RecipientCommission> coordinatorBreakdown = new ArrayList<>();
}
