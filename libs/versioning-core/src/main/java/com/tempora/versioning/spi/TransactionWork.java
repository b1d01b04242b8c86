package com.tempora.versioning.spi;

/** Unit of work executed against a {@link StoreTransaction}. */
@FunctionalInterface
public interface TransactionWork<T> {

    T run(StoreTransaction tx);
}
