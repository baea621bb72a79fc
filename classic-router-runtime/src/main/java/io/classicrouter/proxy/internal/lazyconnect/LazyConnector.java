/*
 * Copyright Classic Router Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.classicrouter.proxy.internal.lazyconnect;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;

import io.classicrouter.proxy.config.RouteConfig;
import io.classicrouter.proxy.internal.ClassicConnection;
import io.classicrouter.proxy.internal.SystemVariables;
import io.classicrouter.proxy.internal.TrxCharacteristics;
import io.classicrouter.proxy.internal.processor.ChangeUserSender;
import io.classicrouter.proxy.internal.processor.ConnectProcessor;
import io.classicrouter.proxy.internal.processor.InitSchemaSender;
import io.classicrouter.proxy.internal.processor.Processor;
import io.classicrouter.proxy.internal.processor.QuerySender;
import io.classicrouter.proxy.internal.processor.QuitSender;
import io.classicrouter.proxy.internal.processor.ResetConnectionSender;
import io.classicrouter.proxy.internal.processor.ServerGreetor;
import io.classicrouter.proxy.internal.processor.SetOptionSender;
import io.classicrouter.proxy.internal.require.RequiredAttributes;
import io.classicrouter.proxy.internal.require.RequiredAttributesFetcher;
import io.classicrouter.proxy.internal.require.RequiredConnectionAttributes;
import io.classicrouter.proxy.internal.require.RequirementNotMetException;
import io.classicrouter.proxy.internal.tracing.TraceSpan;
import io.classicrouter.proxy.internal.util.Metrics;
import io.classicrouter.proxy.protocol.Capability;
import io.classicrouter.proxy.protocol.ClientSideProtocolState;
import io.classicrouter.proxy.protocol.OkMessage;
import io.classicrouter.proxy.protocol.ServerError;
import io.classicrouter.proxy.protocol.ServerMode;
import io.classicrouter.proxy.protocol.ServerSideProtocolState;
import io.classicrouter.proxy.protocol.SetOption;
import io.classicrouter.proxy.protocol.SqlQuoting;
import io.classicrouter.proxy.protocol.Value;
import io.classicrouter.proxy.service.PooledConnection;
import io.classicrouter.proxy.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Attaches a server connection to the client connection and brings the server's session into
 * the state the client expects.
 * <p>
 * The server connection is either a fresh one, which gets a full handshake, or one from the
 * pool, which was last used by some other client and is reset or switched to the client's user.
 * Afterwards the client's session variables, multi-statement option, schema and transaction
 * characteristics are restored on it. None of this traffic is seen by the client.
 * </p>
 * <p>
 * Failures are collected and reported once, through the error callback, when the connector is
 * done. Two failures are handled on the way:</p>
 * <ul>
 *   <li>a transient error from a fresh server's handshake retries the connect after
 *   {@link RouteConfig#connectRetryInterval()}, until {@link RouteConfig#connectRetryTimeout()}
 *   has passed since the connector started</li>
 *   <li>a read-only server that hasn't caught up with the client's writes in time is given
 *   back and the whole sequence restarts once against a read-write server</li>
 * </ul>
 */
public class LazyConnector extends Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LazyConnector.class);

    public static final ServerError ACCESS_DENIED = new ServerError(1045, "Access denied", "28000");
    public static final ServerError WAIT_FOR_MY_WRITES_TIMED_OUT = ServerError.general("wait_for_my_writes timed out");

    // ER_CON_COUNT_ERROR, ER_TOO_MANY_USER_CONNECTIONS
    private static final Set<Integer> TRANSIENT_CONNECT_ERRORS = Set.of(1040, 1203);

    // session variables a shared connection needs to know
    private static final List<String> TRACKED_SYSTEM_VARIABLES = List.of("collation_connection", "character_set_client", "sql_mode");

    public enum Stage {
        CONNECT,
        CONNECTED,
        AUTHENTICATED,
        SET_VARS,
        SET_VARS_DONE,
        SET_SERVER_OPTION,
        SET_SERVER_OPTION_DONE,
        FETCH_SYS_VARS,
        FETCH_SYS_VARS_DONE,
        SET_SCHEMA,
        SET_SCHEMA_DONE,
        WAIT_GTID_EXECUTED,
        WAIT_GTID_EXECUTED_DONE,
        SET_TRX_CHARACTERISTICS,
        SET_TRX_CHARACTERISTICS_DONE,
        FETCH_USER_ATTRS,
        FETCH_USER_ATTRS_DONE,
        SEND_AUTH_OK,
        POOL_OR_CLOSE,
        FALLBACK_TO_WRITE,
        DONE
    }

    private final boolean inHandshake;
    private final Consumer<ServerError> onError;
    private final @Nullable TraceSpan parentSpan;
    private final Instant started;

    private final Counter retryCounter;
    private final Counter fallbackCounter;
    private final Counter failureCounter;

    private Stage stage = Stage.CONNECT;
    private @Nullable ServerError failure;
    private boolean retryConnect;
    private boolean alreadyFallback;
    private boolean reported;

    // remaining transaction characteristics statements, separated by ';'
    private String trxStatement = "";
    private @Nullable RequiredConnectionAttributes requiredAttributes;

    private @Nullable TraceSpan connectSpan;
    private @Nullable TraceSpan authenticateSpan;
    private @Nullable TraceSpan setVarsSpan;
    private @Nullable TraceSpan fetchSysVarsSpan;
    private @Nullable TraceSpan setSchemaSpan;
    private @Nullable TraceSpan waitGtidExecutedSpan;
    private @Nullable TraceSpan setTrxCharacteristicsSpan;

    /**
     * @param connection connection to attach a server connection to
     * @param inHandshake true if the client is waiting for the result of its handshake, which the
     *     connector then sends when it succeeds
     * @param onError receives the failure, if any, once the connector is done
     * @param parentSpan span to add the connector's spans to
     */
    public LazyConnector(ClassicConnection connection,
                         boolean inHandshake,
                         Consumer<ServerError> onError,
                         @Nullable TraceSpan parentSpan) {
        super(connection);
        this.inHandshake = inHandshake;
        this.onError = Objects.requireNonNull(onError);
        this.parentSpan = parentSpan;
        this.started = connection.context().clock().instant();
        this.retryCounter = Metrics.lazyConnectRetryCounter().withTags();
        this.fallbackCounter = Metrics.lazyConnectFallbackCounter().withTags();
        this.failureCounter = Metrics.lazyConnectFailureCounter().withTags();
    }

    @Override
    public Result process() {
        return switch (stage) {
            case CONNECT -> connect();
            case CONNECTED -> connected();
            case AUTHENTICATED -> authenticated();
            case SET_VARS -> setVars();
            case SET_VARS_DONE -> setVarsDone();
            case SET_SERVER_OPTION -> setServerOption();
            case SET_SERVER_OPTION_DONE -> setServerOptionDone();
            case FETCH_SYS_VARS -> fetchSysVars();
            case FETCH_SYS_VARS_DONE -> fetchSysVarsDone();
            case SET_SCHEMA -> setSchema();
            case SET_SCHEMA_DONE -> setSchemaDone();
            case WAIT_GTID_EXECUTED -> waitGtidExecuted();
            case WAIT_GTID_EXECUTED_DONE -> waitGtidExecutedDone();
            case SET_TRX_CHARACTERISTICS -> setTrxCharacteristics();
            case SET_TRX_CHARACTERISTICS_DONE -> setTrxCharacteristicsDone();
            case FETCH_USER_ATTRS -> fetchUserAttrs();
            case FETCH_USER_ATTRS_DONE -> fetchUserAttrsDone();
            case SEND_AUTH_OK -> sendAuthOk();
            case POOL_OR_CLOSE -> poolOrClose();
            case FALLBACK_TO_WRITE -> fallbackToWrite();
            case DONE -> done();
        };
    }

    public Stage stage() {
        return stage;
    }

    /**
     * Records a failure, replacing an earlier one. A null clears the failure.
     */
    public void failed(@Nullable ServerError error) {
        if (error != null) {
            LOGGER.debug("{}: connect failed in {}: {} ({})",
                    connection().connectionId(), stage, error.message(), error.code());
        }
        this.failure = error;
    }

    public Optional<ServerError> failure() {
        return Optional.ofNullable(failure);
    }

    private Result connect() {
        traceStage("connect::connect");

        if (connectSpan == null || connectSpan.isEnded()) {
            connectSpan = TraceSpan.start(connection().context().tracer(), "mysql/prepare_server_connection", parentSpan);
        }

        if (!connection().isServerOpen()) {
            if (connection().serverChannel() != null) {
                LOGGER.debug("{}: dropping closed server connection", connection().connectionId());
                connection().closeServer();
            }

            stage = Stage.CONNECTED;

            // takes a connection from the pool or opens a fresh one
            connection().pushProcessor(new ConnectProcessor(connection(), this::failed, connectSpan));
        }
        else {
            // still connected, nothing to do
            stage = Stage.DONE;
        }

        return Result.AGAIN;
    }

    private Result connected() {
        ClassicConnection connection = connection();

        if (!connection.isServerOpen()) {
            traceStage("connect::not_connected");

            stage = Stage.DONE;
            return Result.AGAIN;
        }

        TraceSpan span = TraceSpan.start(connection.context().tracer(), "mysql/authenticate", connectSpan);
        authenticateSpan = span;

        // later stages overwrite the connection's characteristics as they restore them
        trxStatement = connection.trxCharacteristics()
                .map(TrxCharacteristics::characteristics)
                .orElse("");

        ClientSideProtocolState clientProtocol = connection.clientProtocol();
        ServerSideProtocolState serverProtocol = connection.serverProtocol();

        if (serverProtocol.serverGreeting().isPresent()) {
            // from the pool, authenticated as whoever used it last
            connection.setClientGreetingSent(true);

            boolean sameUser = clientProtocol.username().equals(serverProtocol.username());
            boolean sameAttributes = clientProtocol.sentAttributes().equals(serverProtocol.sentAttributes());

            if (!inHandshake && sameUser && sameAttributes) {
                // a different schema is fine, setSchema() takes care of it
                span.setAttribute("mysql.remote.needs_full_handshake", false);

                connection.pushProcessor(new ResetConnectionSender(connection, this::failed, span));
                connection.setAuthenticated(true);
            }
            else {
                span.setAttribute("mysql.remote.needs_full_handshake", true)
                        .setAttribute("mysql.remote.username_differs", !sameUser)
                        .setAttribute("mysql.remote.connection_attributes_differ", !sameAttributes);

                connection.pushProcessor(new ChangeUserSender(connection, this::failed, span));
            }
        }
        else {
            span.setAttribute("mysql.remote.needs_full_handshake", true);

            connection.pushProcessor(new ServerGreetor(connection, this::greetingFailed, span));
        }

        stage = Stage.AUTHENTICATED;
        return Result.AGAIN;
    }

    private void greetingFailed(ServerError error) {
        ClassicConnection connection = connection();

        // Only retry if the client's password is known or the failure came before the greeting.
        // Otherwise the client would see the auth-switch of each attempt.
        boolean canRetry = connection.clientProtocol().password().isPresent()
                || connection.serverProtocol().serverGreeting().isEmpty();
        Instant deadline = started.plus(connection.context().config().connectRetryTimeout());

        if (TRANSIENT_CONNECT_ERRORS.contains(error.code())
                && canRetry
                && connection.context().clock().instant().isBefore(deadline)) {
            LOGGER.debug("{}: transient connect error, will retry: {} ({})",
                    connection.connectionId(), error.message(), error.code());
            retryConnect = true;
        }
        else {
            failed(error);
        }
    }

    private Result authenticated() {
        ClassicConnection connection = connection();

        if (!connection.isAuthenticated() || !connection.isServerOpen()) {
            traceStage("connect::authenticate::error");

            if (authenticateSpan != null) {
                authenticateSpan.endWithError();
            }

            if (retryConnect) {
                retryConnect = false;
                retryCounter.increment();

                stage = Stage.CONNECT;
                connection.resumeAfter(connection.context().config().connectRetryInterval());
                return Result.SUSPEND;
            }

            if (failure == null) {
                failed(LOST_CONNECTION);
            }

            stage = Stage.DONE;
            return Result.AGAIN;
        }

        traceStage("connect::authenticate::ok");

        if (authenticateSpan != null) {
            authenticateSpan.end();
        }

        stage = Stage.SET_VARS;
        return Result.AGAIN;
    }

    private Result setVars() {
        ClassicConnection connection = connection();
        SystemVariables systemVariables = connection.executionContext().systemVariables();

        boolean needSessionTrackers = connection.context().config().connectionSharing()
                && connection.isGreetingFromRouter();

        Optional<String> stmt = SessionVariableStatements.setSessionVariables(systemVariables, needSessionTrackers);
        if (stmt.isEmpty()) {
            stage = Stage.SET_SERVER_OPTION;
            return Result.AGAIN;
        }

        traceStage("connect::set_var");

        TraceSpan span = TraceSpan.start(connection.context().tracer(), "mysql/set_var", connectSpan);
        setVarsSpan = span;
        for (Map.Entry<String, Value> variable : systemVariables) {
            if (variable.getKey().equals(SessionVariableStatements.STATEMENT_ID)) {
                continue;
            }
            span.setAttribute("mysql.session.@@SESSION." + variable.getKey(),
                    variable.getValue().asOptional().orElse("NULL"));
        }

        stage = Stage.SET_VARS_DONE;
        connection.pushProcessor(new QuerySender(connection, stmt.get(), new FailedQueryHandler(this::failed, stmt.get())));
        return Result.AGAIN;
    }

    private Result setVarsDone() {
        endSpan(setVarsSpan);

        traceStage("connect::set_var::done");

        stage = Stage.SET_SERVER_OPTION;
        return Result.AGAIN;
    }

    private Result setServerOption() {
        ClassicConnection connection = connection();

        boolean clientHasMultiStatements = connection.clientProtocol().hasClientCapability(Capability.MULTI_STATEMENTS);
        boolean serverHasMultiStatements = connection.serverProtocol().hasClientCapability(Capability.MULTI_STATEMENTS);

        if (clientHasMultiStatements == serverHasMultiStatements) {
            stage = Stage.FETCH_SYS_VARS;
            return Result.AGAIN;
        }

        traceStage("connect::set_server_option");

        stage = Stage.SET_SERVER_OPTION_DONE;
        connection.pushProcessor(new SetOptionSender(connection, SetOption.multiStatements(clientHasMultiStatements), this::failed));
        return Result.AGAIN;
    }

    private Result setServerOptionDone() {
        if (failure != null) {
            traceStage("connect::set_server_option::failed");
            stage = Stage.DONE;
        }
        else {
            traceStage("connect::set_server_option::done");
            stage = Stage.FETCH_SYS_VARS;
        }
        return Result.AGAIN;
    }

    private Result fetchSysVars() {
        ClassicConnection connection = connection();

        StringBuilder query = new StringBuilder();
        if (connection.isConnectionSharingPossible()) {
            SystemVariables systemVariables = connection.executionContext().systemVariables();
            for (String name : TRACKED_SYSTEM_VARIABLES) {
                if (systemVariables.find(name).isPresent()) {
                    continue;
                }
                if (query.length() != 0) {
                    query.append(" UNION ");
                }
                // single quotes stay a string literal with ANSI_QUOTES
                query.append("SELECT ").append(SqlQuoting.quoted(name, '\''))
                        .append(", @@SESSION.").append(SqlQuoting.quoted(name, '`'));
            }
        }

        if (query.length() == 0) {
            stage = Stage.SET_SCHEMA;
            return Result.AGAIN;
        }

        traceStage("connect::fetch_sys_vars");

        fetchSysVarsSpan = TraceSpan.start(connection.context().tracer(), "mysql/fetch_sys_vars", connectSpan);

        stage = Stage.FETCH_SYS_VARS_DONE;
        connection.pushProcessor(new QuerySender(connection, query.toString(), new SelectSessionVariablesHandler(connection)));
        return Result.AGAIN;
    }

    private Result fetchSysVarsDone() {
        if (fetchSysVarsSpan != null) {
            fetchSysVarsSpan.end();
        }

        traceStage("connect::fetch_sys_vars::done");

        stage = Stage.SET_SCHEMA;
        return Result.AGAIN;
    }

    private Result setSchema() {
        ClassicConnection connection = connection();

        String clientSchema = connection.clientProtocol().schema();
        String serverSchema = connection.serverProtocol().schema();

        if (clientSchema.isEmpty() || clientSchema.equals(serverSchema)) {
            stage = Stage.WAIT_GTID_EXECUTED;
            return Result.AGAIN;
        }

        traceStage("connect::set_schema");

        setSchemaSpan = TraceSpan.start(connection.context().tracer(), "mysql/set_schema", connectSpan);

        stage = Stage.SET_SCHEMA_DONE;
        connection.pushProcessor(new InitSchemaSender(connection, clientSchema, this::failed));
        return Result.AGAIN;
    }

    private Result setSchemaDone() {
        endSpan(setSchemaSpan);

        if (failure != null) {
            traceStage("connect::set_schema::failed");

            stage = Stage.DONE;
            return Result.AGAIN;
        }

        traceStage("connect::set_schema::done");

        stage = Stage.WAIT_GTID_EXECUTED;
        return Result.AGAIN;
    }

    private Result waitGtidExecuted() {
        ClassicConnection connection = connection();

        String gtidExecuted = connection.gtidAtLeastExecuted();
        if (!connection.waitForMyWrites()
                || connection.expectedServerMode() != ServerMode.READ_ONLY
                || gtidExecuted.isEmpty()) {
            stage = Stage.SET_TRX_CHARACTERISTICS;
            return Result.AGAIN;
        }

        traceStage("connect::wait_gtid");

        waitGtidExecutedSpan = TraceSpan.start(connection.context().tracer(), "mysql/wait_gtid_executed", connectSpan);

        String stmt = waitGtidExecutedStatement(gtidExecuted, connection.waitForMyWritesTimeout().getSeconds());

        stage = Stage.WAIT_GTID_EXECUTED_DONE;
        connection.pushProcessor(new QuerySender(connection, stmt, new IsTrueHandler(this::failed, WAIT_FOR_MY_WRITES_TIMED_OUT)));
        return Result.AGAIN;
    }

    /**
     * Statement that returns 1 if the server has executed {@code gtidSet}, waiting up to
     * {@code timeoutSeconds} for it.
     */
    @VisibleForTesting
    static String waitGtidExecutedStatement(String gtidSet, long timeoutSeconds) {
        if (timeoutSeconds == 0) {
            return "SELECT GTID_SUBSET(" + SqlQuoting.quoted(gtidSet, '"') + ", @@GLOBAL.gtid_executed)";
        }
        return "SELECT NOT WAIT_FOR_EXECUTED_GTID_SET(" + SqlQuoting.quoted(gtidSet, '"') + ", " + timeoutSeconds + ")";
    }

    private Result waitGtidExecutedDone() {
        if (failure != null) {
            traceStage("connect::wait_gtid::failed");

            endSpan(waitGtidExecutedSpan);

            // the server is fine, it is just behind
            stage = Stage.POOL_OR_CLOSE;
        }
        else {
            traceStage("connect::wait_gtid::done");

            endSpan(waitGtidExecutedSpan);

            stage = Stage.SET_TRX_CHARACTERISTICS;
        }
        return Result.AGAIN;
    }

    private Result poolOrClose() {
        ClassicConnection connection = connection();

        stage = Stage.FALLBACK_TO_WRITE;

        Optional<PooledConnection> poolable = connection.poolableServer();
        if (poolable.isEmpty()) {
            connection.closeServer();
            return Result.AGAIN;
        }

        if (connection.context().connectionPool().add(poolable.get())) {
            traceStage("connect::pooled");

            connection.detachServer();
        }
        else {
            traceStage("connect::pool_full");

            connection.pushProcessor(new QuitSender(connection));
        }

        return Result.AGAIN;
    }

    private Result fallbackToWrite() {
        ClassicConnection connection = connection();

        if (alreadyFallback || connection.expectedServerMode() == ServerMode.READ_WRITE) {
            // only fall back once, and only from a read-only server
            stage = Stage.DONE;
            return Result.AGAIN;
        }

        traceStage("connect::fallback_to_write");
        LOGGER.info("{}: {} server did not catch up, falling back to a {} server",
                connection.connectionId(), connection.expectedServerMode(), ServerMode.READ_WRITE);

        connection.setExpectedServerMode(ServerMode.READ_WRITE);
        alreadyFallback = true;
        fallbackCounter.increment();

        failed(null);

        // the next attempt gets its own span
        if (connectSpan != null) {
            connectSpan.endWithError();
        }

        stage = Stage.CONNECT;
        return Result.AGAIN;
    }

    private Result setTrxCharacteristics() {
        if (trxStatement.isEmpty()) {
            stage = Stage.FETCH_USER_ATTRS;
            return Result.AGAIN;
        }

        ClassicConnection connection = connection();

        traceStage("connect::trx_characteristics");

        setTrxCharacteristicsSpan = TraceSpan.start(connection.context().tracer(), "mysql/set_trx_characteristics", connectSpan);

        StatementSplit split = StatementSplit.of(trxStatement);
        trxStatement = split.rest();

        stage = Stage.SET_TRX_CHARACTERISTICS_DONE;
        connection.pushProcessor(new QuerySender(connection, split.head(), new FailedQueryHandler(this::failed, split.head())));
        return Result.AGAIN;
    }

    private Result setTrxCharacteristicsDone() {
        traceStage("connect::trx_characteristics::done");

        endSpan(setTrxCharacteristicsSpan);

        stage = trxStatement.isEmpty() ? Stage.FETCH_USER_ATTRS : Stage.SET_TRX_CHARACTERISTICS;
        return Result.AGAIN;
    }

    private Result fetchUserAttrs() {
        ClassicConnection connection = connection();

        if (!connection.context().config().routerRequireEnforce()) {
            stage = Stage.SEND_AUTH_OK;
            return Result.AGAIN;
        }

        traceStage("connect::fetch_user_attrs");

        requiredAttributes = null;
        RequiredAttributesFetcher.pushProcessor(connection,
                required -> requiredAttributes = required,
                error -> LOGGER.debug("{}: fetching required connection attributes failed: {}",
                        connection.connectionId(), error.message()));

        stage = Stage.FETCH_USER_ATTRS_DONE;
        return Result.AGAIN;
    }

    private Result fetchUserAttrsDone() {
        traceStage("connect::fetch_user_attrs::done");

        RequiredConnectionAttributes required = requiredAttributes;
        if (required == null) {
            failed(ACCESS_DENIED);

            stage = Stage.DONE;
            return Result.AGAIN;
        }

        try {
            RequiredAttributes.enforce(connection().clientChannel(), required);
        }
        catch (RequirementNotMetException e) {
            LOGGER.info("{}: client connection doesn't meet the user's requirements: {}",
                    connection().connectionId(), e.getMessage());
            failed(ACCESS_DENIED);

            stage = Stage.DONE;
            return Result.AGAIN;
        }

        stage = Stage.SEND_AUTH_OK;
        return Result.AGAIN;
    }

    private Result sendAuthOk() {
        stage = Stage.DONE;

        if (!inHandshake || failure != null) {
            return Result.AGAIN;
        }

        traceStage("connect::ok");

        ClientSideProtocolState clientProtocol = connection().clientProtocol();
        connection().clientChannel().write(new OkMessage(0, 0, clientProtocol.statusFlags(), 0));

        return Result.SEND_TO_CLIENT;
    }

    private Result done() {
        ClassicConnection connection = connection();

        ServerError error = failure;
        if (error != null && !reported) {
            traceStage("connect::failed");

            reported = true;
            failureCounter.increment();
            onError.accept(error);
            connection.setAuthenticated(false);
        }

        // the next message to the server starts a new command
        connection.serverProtocol().setSeqId(ServerSideProtocolState.SEQ_ID_NEW_COMMAND);

        if (connectSpan != null) {
            if (error != null) {
                connectSpan.endWithError();
            }
            else {
                connectSpan.end();
            }
        }

        return Result.DONE;
    }

    private void endSpan(@Nullable TraceSpan span) {
        if (span == null) {
            return;
        }
        if (failure != null) {
            span.endWithError();
        }
        else {
            span.end();
        }
    }

    private void traceStage(String event) {
        LOGGER.trace("{}: {}", connection().connectionId(), event);
    }

    /**
     * The first statement of a {@code ;} separated list of statements and the ones after it.
     * <p>
     * Leading whitespace of the rest is dropped.
     * </p>
     */
    @VisibleForTesting
    record StatementSplit(String head, String rest) {

        static StatementSplit of(String statements) {
            int semicolon = statements.indexOf(';');
            if (semicolon < 0) {
                return new StatementSplit(statements, "");
            }
            return new StatementSplit(statements.substring(0, semicolon), statements.substring(semicolon + 1).stripLeading());
        }
    }
}
