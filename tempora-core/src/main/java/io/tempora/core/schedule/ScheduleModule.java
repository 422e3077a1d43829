package io.tempora.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerConfig.class).toProvider(SchedulerConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleEvaluator.class).in(Scopes.SINGLETON);
    }
}
