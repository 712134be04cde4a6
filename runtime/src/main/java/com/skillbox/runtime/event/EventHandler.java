package com.skillbox.runtime.event;

import java.util.Objects;

/**
 * Callback invoked by the {@link EventBus} for every matching event.
 *
 * Subscriptions are de-duplicated with {@link Object#equals}. A plain lambda
 * is only equal to itself, so re-subscribing the same lambda instance is a
 * no-op while a freshly created lambda is not. Components that subscribe one
 * of their own methods should wrap it with {@link #bound}, which compares by
 * receiver identity and method name.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;

    /**
     * Wrap a method of {@code receiver} so that two wrappers created for the
     * same receiver and method name are equal.
     */
    static EventHandler bound(Object receiver, String methodName, EventHandler delegate) {
        return new Bound(receiver, methodName, delegate);
    }

    final class Bound implements EventHandler {

        private final Object       receiver;
        private final String       methodName;
        private final EventHandler delegate;

        private Bound(Object receiver, String methodName, EventHandler delegate) {
            this.receiver   = Objects.requireNonNull(receiver, "receiver");
            this.methodName = Objects.requireNonNull(methodName, "methodName");
            this.delegate   = Objects.requireNonNull(delegate, "delegate");
        }

        @Override
        public void handle(Event event) throws Exception {
            delegate.handle(event);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Bound other)) return false;
            return receiver == other.receiver && methodName.equals(other.methodName);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(receiver) + methodName.hashCode();
        }

        @Override
        public String toString() {
            return receiver.getClass().getSimpleName() + "#" + methodName;
        }
    }
}
