package com.stackforge.core.config;

import com.stackforge.core.hooks.HookFactory;
import com.stackforge.core.hooks.HookRegistry;
import com.stackforge.core.model.Stack;
import com.stackforge.core.project.Project;
import com.stackforge.core.project.ProjectLoader;
import com.stackforge.core.provider.StackProviderFactory;
import com.stackforge.core.resolver.ResolverFactory;
import com.stackforge.core.resolver.ResolverRegistry;
import com.stackforge.core.template.FileTemplateHandler;
import com.stackforge.core.template.TemplateHandler;
import com.stackforge.core.template.TemplateHandlerRegistry;
import com.stackforge.provider.local.LocalStackProviderFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the registries, the provider factory and the project loader.
 * <p>
 * Extra resolvers, hooks and template handlers are picked up from any bean
 * implementing {@link ResolverFactory}, {@link HookFactory} or
 * {@link TemplateHandler}, next to the built-in ones.
 */
@Configuration
public class StackforgeConfig {

    private static final Logger log = LoggerFactory.getLogger(StackforgeConfig.class);

    @Bean
    public ResolverRegistry resolverRegistry(ObjectProvider<ResolverFactory> extensions) {
        var factories = new ArrayList<>(ResolverRegistry.builtins());
        extensions.orderedStream().forEach(factories::add);
        return new ResolverRegistry(factories);
    }

    @Bean
    public HookRegistry hookRegistry(ObjectProvider<HookFactory> extensions) {
        var factories = new ArrayList<>(HookRegistry.builtins());
        extensions.orderedStream().forEach(factories::add);
        return new HookRegistry(factories);
    }

    @Bean
    public TemplateHandlerRegistry templateHandlerRegistry(StackforgeProperties properties,
                                                           ObjectProvider<TemplateHandler> extensions) {
        List<TemplateHandler> handlers = new ArrayList<>();
        handlers.add(new FileTemplateHandler(projectDir(properties).resolve(Project.TEMPLATES_DIR)));
        extensions.orderedStream().forEach(handlers::add);
        return new TemplateHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnProperty(name = "stackforge.provider", havingValue = "local", matchIfMissing = true)
    public StackProviderFactory localStackProviderFactory(StackforgeProperties properties) {
        Path stateDir = projectDir(properties).resolve(properties.getStateDir());
        log.info("Using the local stack provider with state in {}", stateDir);
        return new LocalStackProviderFactory(stateDir);
    }

    @Bean
    public ProjectLoader projectLoader(ResolverRegistry resolvers, HookRegistry hooks,
                                       StackforgeProperties properties) {
        var defaults = new LinkedHashMap<String, Object>();
        putIfSet(defaults, Stack.PROJECT_CODE, properties.getProjectCode());
        putIfSet(defaults, Stack.REGION, properties.getRegion());
        putIfSet(defaults, Stack.PROFILE, properties.getProfile());
        return new ProjectLoader(resolvers, hooks, defaults);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    static Path projectDir(StackforgeProperties properties) {
        return Path.of(properties.getProjectDir());
    }

    private static void putIfSet(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }
}
