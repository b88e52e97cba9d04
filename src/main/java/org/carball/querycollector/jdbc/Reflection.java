package org.carball.querycollector.jdbc;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

final class Reflection {

    private Reflection() {
    }

    /**
     * Invokes {@code method} on {@code target}, rethrowing what the driver threw rather than the reflective wrapper.
     */
    static Object invoke(Object target, Method method, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
