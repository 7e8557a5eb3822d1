package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Destination account of a bank transfer. Null fields of an override fall back to the
 * configured account.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BankAccountDetails {

    private String bankName;
    private String accountNumber;
    private String accountName;
    private String branchCode;
    private String swiftCode;

    public BankAccountDetails mergedWith(BankAccountDetails override) {
        if (override == null) {
            return this;
        }
        return BankAccountDetails.builder()
                .bankName(override.getBankName() != null ? override.getBankName() : bankName)
                .accountNumber(override.getAccountNumber() != null ? override.getAccountNumber() : accountNumber)
                .accountName(override.getAccountName() != null ? override.getAccountName() : accountName)
                .branchCode(override.getBranchCode() != null ? override.getBranchCode() : branchCode)
                .swiftCode(override.getSwiftCode() != null ? override.getSwiftCode() : swiftCode)
                .build();
    }
}
