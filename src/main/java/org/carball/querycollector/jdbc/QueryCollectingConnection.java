package org.carball.querycollector.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.carball.querycollector.collector.QueryCollector;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Objects;

/**
 * Routes the statements of a JDBC {@link Connection} through a {@link QueryCollector}.
 *
 * <pre>{@code
 * Connection connection = QueryCollectingConnection.wrap(dataSource.getConnection(), collector);
 * collector.startCollection();
 * // ... run the code under analysis against connection ...
 * collector.stopCollection();
 * }</pre>
 *
 * Statements created from the returned connection report every {@code execute*} call to the collector;
 * everything else passes straight through to the driver.
 */
@Slf4j
public final class QueryCollectingConnection implements InvocationHandler {

    private final Connection target;
    private final QueryCollector collector;
    private Connection proxy;

    private QueryCollectingConnection(Connection target, QueryCollector collector) {
        this.target = target;
        this.collector = collector;
    }

    public static Connection wrap(Connection connection, QueryCollector collector) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(collector, "collector");

        QueryCollectingConnection handler = new QueryCollectingConnection(connection, collector);
        handler.proxy = (Connection) Proxy.newProxyInstance(
                QueryCollectingConnection.class.getClassLoader(),
                new Class<?>[] {Connection.class},
                handler);
        log.debug("Wrapped JDBC connection {} for query collection", connection);
        return handler.proxy;
    }

    @Override
    public Object invoke(Object proxyInstance, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return proxyInstance == args[0];
            case "hashCode":
                return System.identityHashCode(proxyInstance);
            case "toString":
                return "QueryCollectingConnection[" + target + "]";
            case "createStatement":
                return wrapStatement(Statement.class, (Statement) Reflection.invoke(target, method, args), null);
            case "prepareStatement":
                return wrapStatement(PreparedStatement.class,
                        (Statement) Reflection.invoke(target, method, args), (String) args[0]);
            case "prepareCall":
                return wrapStatement(CallableStatement.class,
                        (Statement) Reflection.invoke(target, method, args), (String) args[0]);
            default:
                return Reflection.invoke(target, method, args);
        }
    }

    private Object wrapStatement(Class<? extends Statement> type, Statement statement, String preparedSql) {
        return Proxy.newProxyInstance(
                QueryCollectingConnection.class.getClassLoader(),
                new Class<?>[] {type},
                new CollectingStatementHandler(statement, proxy, collector, preparedSql));
    }
}
