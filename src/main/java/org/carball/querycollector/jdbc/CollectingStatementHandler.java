package org.carball.querycollector.jdbc;

import org.carball.querycollector.collector.QueryCollector;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Proxy handler for statements handed out by {@link QueryCollectingConnection}.
 *
 * <p>For prepared statements the SQL comes from {@code prepareStatement} and the parameters from the
 * index-based {@code setXxx} calls; named {@code CallableStatement} parameters are not recorded. A batch is
 * reported as a single execution with the batch flag set: plain statements join their SQL with {@code ";\n"},
 * prepared statements report one parameter list per {@code addBatch()}.
 *
 * <p>{@code unwrap} answers with the proxy itself for any interface the proxy implements, so unwrapping to
 * {@code Statement} or {@code PreparedStatement} keeps collection in place. Only vendor-specific interfaces reach
 * the driver's own statement, and executions through that object are not recorded.
 */
class CollectingStatementHandler implements InvocationHandler {

    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate");
    private static final Set<String> BATCH_METHODS = Set.of("executeBatch", "executeLargeBatch");
    private static final String BATCH_SEPARATOR = ";\n";

    private final Statement target;
    private final Connection connection;
    private final QueryCollector collector;
    private final String preparedSql;

    private final TreeMap<Integer, Object> parameters = new TreeMap<>();
    private final List<String> batchSql = new ArrayList<>();
    private final List<List<Object>> batchParameters = new ArrayList<>();

    CollectingStatementHandler(Statement target, Connection connection, QueryCollector collector,
                               String preparedSql) {
        this.target = target;
        this.connection = connection;
        this.collector = collector;
        this.preparedSql = preparedSql;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        String name = method.getName();
        int argCount = args == null ? 0 : args.length;

        if (name.equals("equals") && argCount == 1) {
            return proxy == args[0];
        }
        if (name.equals("hashCode") && argCount == 0) {
            return System.identityHashCode(proxy);
        }
        if (name.equals("toString") && argCount == 0) {
            return "CollectingStatement[" + target + "]";
        }
        if (name.equals("getConnection") && argCount == 0) {
            return connection;
        }
        if (name.equals("unwrap") && argCount == 1 && args[0] instanceof Class<?> iface && iface.isInstance(proxy)) {
            return proxy;
        }
        if (name.equals("isWrapperFor") && argCount == 1 && args[0] instanceof Class<?> iface
                && iface.isInstance(proxy)) {
            return true;
        }

        if (EXECUTE_METHODS.contains(name)) {
            if (argCount > 0 && args[0] instanceof String sql) {
                return collect(method, args, sql, List.of(), false);
            }
            return collect(method, args, preparedSql, currentParameters(), false);
        }

        if (BATCH_METHODS.contains(name)) {
            try {
                if (preparedSql != null) {
                    return collect(method, args, preparedSql, new ArrayList<>(batchParameters), true);
                }
                return collect(method, args, String.join(BATCH_SEPARATOR, batchSql), List.of(), true);
            } finally {
                batchSql.clear();
                batchParameters.clear();
            }
        }

        switch (name) {
            case "addBatch":
                if (argCount == 1 && args[0] instanceof String sql) {
                    batchSql.add(sql);
                } else {
                    batchParameters.add(currentParameters());
                }
                break;
            case "clearBatch":
                batchSql.clear();
                batchParameters.clear();
                break;
            case "clearParameters":
                parameters.clear();
                break;
            default:
                if (preparedSql != null && name.startsWith("set") && argCount >= 2 && args[0] instanceof Integer index) {
                    parameters.put(index, name.equals("setNull") ? null : args[1]);
                }
        }
        return Reflection.invoke(target, method, args);
    }

    private Object collect(Method method, Object[] args, String sql, List<?> params, boolean batch) throws Exception {
        return collector.intercept(
                (s, p, b, context) -> Reflection.invoke(target, method, args),
                sql,
                params,
                batch,
                new JdbcExecutionContext(method.getName()));
    }

    private List<Object> currentParameters() {
        if (parameters.isEmpty()) {
            return new ArrayList<>();
        }
        int highest = parameters.lastKey();
        List<Object> values = new ArrayList<>(highest);
        for (int i = 1; i <= highest; i++) {
            values.add(parameters.get(i));
        }
        return values;
    }
}
