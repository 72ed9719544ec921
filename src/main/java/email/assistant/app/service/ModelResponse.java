package email.assistant.app.service;

import java.util.function.Function;

/**
 * Result of parsing a model reply that was supposed to be JSON: either the parsed value
 * or the raw text that could not be parsed.
 */
public abstract class ModelResponse<T> {

    private ModelResponse() {
    }

    public static <T> ModelResponse<T> ok(T value) {
        return new Ok<>(value);
    }

    public static <T> ModelResponse<T> malformed(String rawText) {
        return new Malformed<>(rawText);
    }

    public abstract boolean isOk();

    /**
     * The parsed value, or the recovery function applied to the raw text.
     */
    public abstract T recover(Function<String, T> recovery);

    public abstract <R> ModelResponse<R> map(Function<T, R> mapper);

    public static final class Ok<T> extends ModelResponse<T> {
        private final T value;

        private Ok(T value) {
            this.value = value;
        }

        public T value() {
            return value;
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T recover(Function<String, T> recovery) {
            return value;
        }

        @Override
        public <R> ModelResponse<R> map(Function<T, R> mapper) {
            return new Ok<>(mapper.apply(value));
        }
    }

    public static final class Malformed<T> extends ModelResponse<T> {
        private final String rawText;

        private Malformed(String rawText) {
            this.rawText = rawText;
        }

        /** Null when the model produced nothing at all. */
        public String rawText() {
            return rawText;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T recover(Function<String, T> recovery) {
            return recovery.apply(rawText);
        }

        @Override
        public <R> ModelResponse<R> map(Function<T, R> mapper) {
            return new Malformed<>(rawText);
        }
    }
}
