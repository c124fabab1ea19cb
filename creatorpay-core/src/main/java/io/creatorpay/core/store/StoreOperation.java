package io.creatorpay.core.store;

public enum StoreOperation {
    INSERT,
    UPDATE,
    DELETE,
    READ
}
