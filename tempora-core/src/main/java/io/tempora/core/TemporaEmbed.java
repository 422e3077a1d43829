package io.tempora.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Stage;
import com.google.inject.util.Modules;
import io.tempora.core.database.DataSourceProvider;
import io.tempora.core.database.DatabaseModule;
import io.tempora.core.metrics.MetricsModule;
import io.tempora.core.schedule.ScheduleExecutor;
import io.tempora.core.schedule.ScheduleExecutorModule;
import io.tempora.core.schedule.ScheduleModule;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigFactory;
import io.tempora.spi.config.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the scheduler, its store and its configuration into one injector.
 *
 * A {@link io.tempora.spi.dispatch.TaskDispatcher} binding must be added
 * through {@link Bootstrap#addModules(Module...)}.
 */
public class TemporaEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(TemporaEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private Config systemConfig = null;
        private boolean withScheduleExecutor = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(Config systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap withScheduleExecutor(boolean v)
        {
            this.withScheduleExecutor = v;
            return this;
        }

        public TemporaEmbed initialize()
        {
            List<Module> modules = standardModules();
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(Stage.PRODUCTION, ImmutableList.<Module>builder()
                    .add(binder -> binder.requireExplicitBindings())
                    .addAll(modules)
                    .build());

            TemporaEmbed embed = new TemporaEmbed(injector, withScheduleExecutor);
            if (withScheduleExecutor) {
                injector.getInstance(ScheduleExecutor.class).start();
            }
            return embed;
        }

        private List<Module> standardModules()
        {
            ObjectMapper mapper = ObjectMappers.objectMapper();
            ConfigFactory cf = new ConfigFactory(mapper);
            Config config = systemConfig != null ? systemConfig : cf.create();

            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            builder.add(
                    new DatabaseModule(),
                    new ScheduleModule(),
                    new MetricsModule(),
                    (binder) -> {
                        binder.bind(ObjectMapper.class).toInstance(mapper);
                        binder.bind(ConfigFactory.class).toInstance(cf);
                        binder.bind(Config.class).toInstance(config);
                        binder.bind(Clock.class).toInstance(Clock.systemUTC());
                    });
            if (withScheduleExecutor) {
                builder.add(new ScheduleExecutorModule());
            }
            return builder.build();
        }
    }

    private final Injector injector;
    private final boolean withScheduleExecutor;

    TemporaEmbed(Injector injector, boolean withScheduleExecutor)
    {
        this.injector = injector;
        this.withScheduleExecutor = withScheduleExecutor;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public ScheduleExecutor getScheduleExecutor()
    {
        return injector.getInstance(ScheduleExecutor.class);
    }

    @Override
    public void close() throws Exception
    {
        try {
            if (withScheduleExecutor) {
                getScheduleExecutor().eagerShutdown();
            }
        }
        finally {
            logger.debug("Closing data source");
            injector.getInstance(DataSourceProvider.class).close();
        }
    }
}
