package alpha.lapis;

import alpha.lapis.message.Headers;
import alpha.lapis.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

final class DefaultConfig implements Config {
    private final Builder  builder;
    private final int      maxRequestHeadSize,
                           maxRequestBodySize;
    private final Duration timeoutHandler,
                           timeoutGracefulStop;
    private final boolean  verboseErrors;
    private final String   serverName,
                           leafFileName;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder             = b;
        maxRequestHeadSize  = s.maxRequestHeadSize;
        maxRequestBodySize  = s.maxRequestBodySize;
        timeoutHandler      = s.timeoutHandler;
        timeoutGracefulStop = s.timeoutGracefulStop;
        verboseErrors       = s.verboseErrors;
        serverName          = s.serverName;
        leafFileName        = s.leafFileName;
    }

    @Override
    public int maxRequestHeadSize() {
        return maxRequestHeadSize;
    }

    @Override
    public int maxRequestBodySize() {
        return maxRequestBodySize;
    }

    @Override
    public Optional<Duration> timeoutHandler() {
        return Optional.ofNullable(timeoutHandler);
    }

    @Override
    public Duration timeoutGracefulStop() {
        return timeoutGracefulStop;
    }

    @Override
    public boolean verboseErrors() {
        return verboseErrors;
    }

    @Override
    public Optional<String> serverName() {
        return Optional.ofNullable(serverName);
    }

    @Override
    public String leafFileName() {
        return leafFileName;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "maxRequestHeadSize=" + maxRequestHeadSize +
                ", maxRequestBodySize=" + maxRequestBodySize +
                ", timeoutHandler=" + timeoutHandler +
                ", timeoutGracefulStop=" + timeoutGracefulStop +
                ", verboseErrors=" + verboseErrors +
                ", serverName=" + serverName +
                ", leafFileName=" + leafFileName + '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            int      maxRequestHeadSize  = 8_000,
                     maxRequestBodySize  = 20_971_520;
            Duration timeoutHandler      = null,
                     timeoutGracefulStop = ofSeconds(5);
            boolean  verboseErrors       = false;
            String   serverName          = null,
                     leafFileName        = "route.properties";
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder maxRequestHeadSize(int newVal) {
            return new DefaultBuilder(this, s -> s.maxRequestHeadSize = newVal);
        }

        @Override
        public Builder maxRequestBodySize(int newVal) {
            return new DefaultBuilder(this, s -> s.maxRequestBodySize = newVal);
        }

        @Override
        public Builder timeoutHandler(Duration newVal) {
            return new DefaultBuilder(this, s -> s.timeoutHandler = newVal);
        }

        @Override
        public Builder timeoutGracefulStop(Duration newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.timeoutGracefulStop = newVal);
        }

        @Override
        public Builder verboseErrors(boolean newVal) {
            return new DefaultBuilder(this, s -> s.verboseErrors = newVal);
        }

        @Override
        public Builder serverName(String newVal) {
            if (newVal != null) {
                Headers.requireValidValue(newVal);
            }
            return new DefaultBuilder(this, s -> s.serverName = newVal);
        }

        @Override
        public Builder leafFileName(String newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.leafFileName = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
