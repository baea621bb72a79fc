/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal;

import java.util.Objects;

/**
 * Transaction characteristics as reported by the server's session tracker.
 * <p>
 * The text replays the characteristics: zero-or-one isolation level statement followed by
 * zero-or-one transaction start statement, separated by a semicolon. For example:
 * </p>
 * <pre>
 * SET TRANSACTION ISOLATION LEVEL SERIALIZABLE; START TRANSACTION READ ONLY;
 * </pre>
 *
 * @param characteristics statements that restore the transaction's characteristics
 */
public record TrxCharacteristics(String characteristics) {

    public TrxCharacteristics {
        Objects.requireNonNull(characteristics);
    }
}
