package com.skillbox.runtime.skill;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Loads and calls JVM skill entries. Shared by the in-process runner and the
 * child-JVM launcher so both execution modes apply the same contract.
 */
public final class SkillEntryInvoker {

    private SkillEntryInvoker() {}

    public static Object instantiate(String className, ClassLoader classLoader) {
        try {
            Class<?> type = Class.forName(className, true, classLoader);
            if (!SkillEntry.class.isAssignableFrom(type) && !AsyncSkillEntry.class.isAssignableFrom(type)) {
                throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                        className + " implements neither SkillEntry nor AsyncSkillEntry");
            }
            return type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                    "Entry class not found: " + className, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                    "Entry class " + className + " failed to initialise: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                    "Cannot instantiate entry class " + className + ": " + e, e);
        }
    }

    /**
     * Call the entry and wait for its result. Async entries are awaited on the
     * calling thread, so interrupting it abandons the wait.
     */
    public static Map<String, Object> invoke(Object entry, Map<String, Object> context) throws Exception {
        if (entry instanceof SkillEntry sync) {
            return sync.execute(context);
        }
        if (entry instanceof AsyncSkillEntry async) {
            try {
                return async.executeAsync(context).toCompletableFuture().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                throw e;
            }
        }
        throw new SkillException(SkillException.Kind.EXECUTION_FAILURE,
                entry.getClass().getName() + " is not a skill entry");
    }
}
