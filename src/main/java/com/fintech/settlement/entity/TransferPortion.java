package com.fintech.settlement.entity;

/**
 * Share of a settlement paid out by bank transfer.
 */
public enum TransferPortion {
    /**
     * National insurer's share.
     */
    SHA,

    /**
     * Union's retained share.
     */
    MWU
}
