package info.isaksson.erland.typeinspect.core;

import info.isaksson.erland.typeinspect.error.MemberInvocationException;
import info.isaksson.erland.typeinspect.error.UnsupportedObjectException;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Reflective calls: varargs packing, access, unwrapping of target exceptions and awaiting
 * asynchronous results.
 *
 * <p>A {@link RuntimeException} or {@link Error} thrown by the target is rethrown as is;
 * checked exceptions and access failures become {@link MemberInvocationException}.</p>
 */
final class Invocations {

    private Invocations() {}

    static Object invoke(Method method, Object receiver, Object[] args) {
        method.trySetAccessible();
        try {
            return method.invoke(receiver, pack(method, args));
        } catch (InvocationTargetException e) {
            throw unwrap(describe(method), e.getCause());
        } catch (IllegalAccessException e) {
            throw new MemberInvocationException("Cannot access " + describe(method), e);
        }
    }

    static Object construct(Constructor<?> constructor, Object[] args) {
        constructor.trySetAccessible();
        try {
            return constructor.newInstance(pack(constructor, args));
        } catch (InvocationTargetException e) {
            throw unwrap(describe(constructor), e.getCause());
        } catch (InstantiationException e) {
            throw new UnsupportedObjectException("Cannot instantiate " + constructor.getDeclaringClass().getName());
        } catch (IllegalAccessException e) {
            throw new MemberInvocationException("Cannot access " + describe(constructor), e);
        }
    }

    /**
     * Collect trailing arguments of a varargs call into the array the executable expects.
     * An argument list that already ends in a matching array (or {@code null}) is passed through.
     */
    static Object[] pack(Executable executable, Object[] args) {
        Object[] given = args == null ? new Object[0] : args;
        if (!executable.isVarArgs()) return given;

        Class<?>[] types = executable.getParameterTypes();
        int fixed = types.length - 1;
        Class<?> arrayType = types[fixed];
        if (given.length == types.length) {
            Object last = given[fixed];
            if (last == null || arrayType.isInstance(last)) return given;
        }
        if (given.length < fixed) return given; // let reflection report the arity mismatch

        Object packed = Array.newInstance(arrayType.getComponentType(), given.length - fixed);
        for (int i = fixed; i < given.length; i++) {
            Array.set(packed, i - fixed, given[i]);
        }
        Object[] out = new Object[types.length];
        System.arraycopy(given, 0, out, 0, fixed);
        out[fixed] = packed;
        return out;
    }

    /** Wait for a {@link CompletionStage} or {@link Future}; any other value is returned unchanged. */
    static Object await(Object result) {
        Future<?> future;
        if (result instanceof CompletionStage<?>) {
            future = ((CompletionStage<?>) result).toCompletableFuture();
        } else if (result instanceof Future<?>) {
            future = (Future<?>) result;
        } else {
            return result;
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap("asynchronous call", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemberInvocationException("Interrupted while waiting for result", e);
        }
    }

    private static RuntimeException unwrap(String what, Throwable cause) {
        if (cause instanceof RuntimeException) return (RuntimeException) cause;
        if (cause instanceof Error) throw (Error) cause;
        return new MemberInvocationException(what + " failed: " + cause, cause);
    }

    private static String describe(Executable executable) {
        return executable.getDeclaringClass().getSimpleName() + "." + executable.getName();
    }
}
