package com.lendingengine.ledger;

/**
 * Kinds of state-change records emitted by the engine.
 */
public enum EventType {
    CREATE_MARKET,
    SUPPLY,
    WITHDRAW,
    BORROW,
    REPAY,
    SUPPLY_COLLATERAL,
    WITHDRAW_COLLATERAL,

    /**
     * Liquidation. assets/shares carry the repaid amounts, secondary fields the bad debt.
     */
    LIQUIDATE,

    FLASH_LOAN,

    /**
     * Interest accrual. assets carries the interest, shares the fee shares minted.
     */
    ACCRUE_INTEREST,

    SET_AUTHORIZATION,
    INCREMENT_NONCE,
    SET_OWNER,
    SET_FEE,
    SET_FEE_RECIPIENT,
    ENABLE_IRM,
    ENABLE_LLTV
}
