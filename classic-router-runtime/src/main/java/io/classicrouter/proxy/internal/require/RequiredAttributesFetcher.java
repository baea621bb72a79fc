/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.require;

import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.processor.QuerySender;
import io.classicrouter.proxy.protocol.Eof;
import io.classicrouter.proxy.protocol.OkMessage;
import io.classicrouter.proxy.protocol.Row;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.service.QueryHandler;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Fetches the {@link RequiredConnectionAttributes} of the user the server connection is
 * authenticated as.
 */
public final class RequiredAttributesFetcher {

    static final String QUERY = "SELECT attribute FROM mysql.user WHERE CONCAT(user, '@', host) = CURRENT_USER()";

    private RequiredAttributesFetcher() {
    }

    /**
     * Pushes the query for the user's attributes onto the connection's processor stack.
     * <p>
     * Exactly one of the callbacks is called, once the query finished.
     * </p>
     *
     * @param connection connection whose server side is authenticated
     * @param onResult receives the requirements
     * @param onError receives the reason the requirements couldn't be fetched
     */
    public static void pushProcessor(ClassicConnection connection,
                                     Consumer<RequiredConnectionAttributes> onResult,
                                     Consumer<ServerError> onError) {
        connection.pushProcessor(new QuerySender(connection, QUERY,
                new UserAttributesHandler(connection.connectionId(), onResult, onError)));
    }

    private static final class UserAttributesHandler implements QueryHandler {

        private static final Logger LOGGER = LoggerFactory.getLogger(UserAttributesHandler.class);

        private final String connectionId;
        private final Consumer<RequiredConnectionAttributes> onResult;
        private final Consumer<ServerError> onError;

        private long rowCount;
        private @Nullable String attributes;
        private @Nullable ServerError failure;

        private UserAttributesHandler(String connectionId,
                                      Consumer<RequiredConnectionAttributes> onResult,
                                      Consumer<ServerError> onError) {
            this.connectionId = connectionId;
            this.onResult = Objects.requireNonNull(onResult);
            this.onError = Objects.requireNonNull(onError);
        }

        @Override
        public void onColumnCount(long count) {
            if (count != 1) {
                failure = ServerError.general("Expected one column, got " + count);
            }
        }

        @Override
        public void onRow(Row row) {
            ++rowCount;
            if (!row.isEmpty()) {
                attributes = row.get(0).value();
            }
        }

        @Override
        public void onRowEnd(Eof eof) {
            if (failure == null && rowCount != 1) {
                failure = ServerError.general("Expected one row, got " + rowCount);
            }

            if (failure != null) {
                onError(failure);
                return;
            }

            RequiredConnectionAttributes required;
            try {
                required = RequiredConnectionAttributes.fromUserAttributes(attributes);
            }
            catch (IllegalArgumentException e) {
                LOGGER.warn("{}: invalid user attributes: {}", connectionId, e.getMessage());
                onError.accept(ServerError.general("Invalid user attributes"));
                return;
            }
            onResult.accept(required);
        }

        @Override
        public void onOk(OkMessage ok) {
            onError(ServerError.general("Expected a resultset"));
        }

        @Override
        public void onError(ServerError error) {
            LOGGER.debug("{}: fetching user attributes failed: {}", connectionId, error.message());

            onError.accept(error);
        }
    }
}
