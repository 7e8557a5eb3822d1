package com.fintech.settlement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settlement settings bound from the "settlement" prefix.
 */
@Data
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private BankTransfer bankTransfer = new BankTransfer();
    private Scheduler scheduler = new Scheduler();
    private Reports reports = new Reports();

    @Data
    public static class BankTransfer {

        /**
         * Shared secret an operator must present to release the SHA/MWU transfers.
         * Transfers are refused while it is unset.
         */
        private String confirmationSecret;

        private Account sha = new Account();
        private Account mwu = new Account();
    }

    @Data
    public static class Account {
        private String bankName;
        private String accountNumber;
        private String accountName;
        private String branchCode;
        private String swiftCode;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String zone = "Africa/Nairobi";

        /**
         * Process the settlement right after the nightly generation.
         */
        private boolean autoProcess = false;

        private String operator = "system-scheduler";
    }

    @Data
    public static class Reports {
        private String directory = "reports";
        private int retentionDays = 90;

        public Path directoryPath() {
            return Paths.get(directory);
        }
    }
}
