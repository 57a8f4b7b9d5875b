package com.atrium.access.spi;

import java.util.function.Supplier;

/**
 * Runs a group of reads and writes atomically: either every write made by {@code work}
 * is kept or, if it throws, none is. The exception is rethrown unchanged.
 */
@FunctionalInterface
public interface UnitOfWork {

    <T> T inTransaction(Supplier<T> work);
}
