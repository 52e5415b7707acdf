package ai.dblookup.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a symbol lookup. A miss is data, not an error: the message is
 * forwarded verbatim to whoever issued the lookup.
 */
public sealed interface Lookup<T> permits Lookup.Found, Lookup.NotFound {

    static <T> Lookup<T> found(T value) {
        return new Found<>(value);
    }

    static <T> Lookup<T> notFound(String message) {
        return new NotFound<>(message);
    }

    boolean isFound();

    Optional<T> asOptional();

    default <R> Lookup<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Found<T> found) {
            return new Found<>(mapper.apply(found.value()));
        }
        return new NotFound<>(((NotFound<T>) this).message());
    }

    record Found<T>(T value) implements Lookup<T> {

        public Found {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isFound() {
            return true;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.of(value);
        }
    }

    record NotFound<T>(String message) implements Lookup<T> {

        public NotFound {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isFound() {
            return false;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.empty();
        }
    }
}
