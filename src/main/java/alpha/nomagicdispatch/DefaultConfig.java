package alpha.nomagicdispatch;

import alpha.nomagicdispatch.HttpConstants.Version;
import alpha.nomagicdispatch.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.function.Consumer;

import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder  builder;
    private final int      maxRequestBodyBufferSize;
    private final Version  minHttpVersion;
    private final int      workerThreads,
                           backlog;
    private final Duration timeoutStop;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                  = b;
        maxRequestBodyBufferSize = s.maxRequestBodyBufferSize;
        minHttpVersion           = s.minHttpVersion;
        workerThreads            = s.workerThreads;
        backlog                  = s.backlog;
        timeoutStop              = s.timeoutStop;
    }
    
    @Override
    public int maxRequestBodyBufferSize() {
        return maxRequestBodyBufferSize;
    }
    
    @Override
    public Version minHttpVersion() {
        return minHttpVersion;
    }
    
    @Override
    public int workerThreads() {
        return workerThreads;
    }
    
    @Override
    public int backlog() {
        return backlog;
    }
    
    @Override
    public Duration timeoutStop() {
        return timeoutStop;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "maxRequestBodyBufferSize=" + maxRequestBodyBufferSize +
                ", minHttpVersion=" + minHttpVersion +
                ", workerThreads=" + workerThreads +
                ", backlog=" + backlog +
                ", timeoutStop=" + timeoutStop +
                '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            int      maxRequestBodyBufferSize = 20_971_520;
            Version  minHttpVersion           = Version.HTTP_1_0;
            int      workerThreads            = 0,
                     backlog                  = 0;
            Duration timeoutStop              = ofSeconds(1);
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder maxRequestBodyBufferSize(int newVal) {
            return new DefaultBuilder(this, s -> s.maxRequestBodyBufferSize = newVal);
        }
        
        @Override
        public Builder minHttpVersion(Version newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.minHttpVersion = newVal);
        }
        
        @Override
        public Builder workerThreads(int newVal) {
            return new DefaultBuilder(this, s -> s.workerThreads = newVal);
        }
        
        @Override
        public Builder backlog(int newVal) {
            return new DefaultBuilder(this, s -> s.backlog = newVal);
        }
        
        @Override
        public Builder timeoutStop(Duration newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.timeoutStop = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
