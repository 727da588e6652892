package com.vigil.runner;

import com.google.gson.Gson;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.vigil.config.ChainConfig;
import com.vigil.config.RunnerConfig;
import com.vigil.data.GsonFactory;
import com.vigil.observe.EventSink;
import com.vigil.observe.JsonlEventSink;
import com.vigil.observe.ProgressStore;
import com.vigil.session.BridgeSessionBootstrapper;
import com.vigil.session.SessionBootstrapper;
import com.vigil.session.SessionStore;
import com.vigil.timing.ChunkedSleeper;
import com.vigil.timing.Sleeper;
import com.vigil.timing.StopSignal;
import com.vigil.util.Randomization;
import okhttp3.OkHttpClient;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Guice module for one runner process. The loaded configuration is bound as is;
 * everything else is derived from it.
 */
public class RunnerModule extends AbstractModule {

    private final RunnerConfig config;

    public RunnerModule(RunnerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(RunnerConfig.class).toInstance(config);
        bind(SessionBootstrapper.class).to(BridgeSessionBootstrapper.class);
    }

    @Provides
    @Singleton
    public Clock provideClock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    public Gson provideGson() {
        return GsonFactory.create();
    }

    @Provides
    @Singleton
    public Randomization provideRandomization() {
        return new Randomization();
    }

    /**
     * Shared connection pool. Bridge and RPC clients derive their own timeouts from it.
     */
    @Provides
    @Singleton
    public OkHttpClient provideHttpClient() {
        ChainConfig chain = config.getChain();
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(chain.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(chain.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Provides
    @Singleton
    public Sleeper provideSleeper(StopSignal stopSignal) {
        return new ChunkedSleeper(stopSignal, config.getPacing().getSleepChunkMs());
    }

    @Provides
    @Singleton
    public SessionStore provideSessionStore() {
        return new SessionStore(Paths.get(config.getSession().getFile()));
    }

    @Provides
    @Singleton
    public EventSink provideEventSink(Gson gson, Clock clock) {
        return new JsonlEventSink(
                Paths.get(config.getLogging().getEventsFile()),
                Paths.get(config.getLogging().getMilestonesFile()),
                gson, clock);
    }

    @Provides
    @Singleton
    public ProgressStore provideProgressStore(Clock clock) {
        return new ProgressStore(Paths.get(config.getApp().getDataDir()),
                config.getPolicy().getTargetLevel(), clock);
    }

    @Provides
    @Singleton
    public WriteExecutor provideWriteExecutor(Clock clock) {
        return new WriteExecutor(clock);
    }
}
