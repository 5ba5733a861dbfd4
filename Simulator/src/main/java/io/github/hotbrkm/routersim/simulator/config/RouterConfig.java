package io.github.hotbrkm.routersim.simulator.config;

import io.github.hotbrkm.routersim.simulator.router.log.ActivityLog;
import io.github.hotbrkm.routersim.simulator.router.log.FileActivityLog;
import io.github.hotbrkm.routersim.simulator.router.metrics.RouterMetricsRecorder;
import io.github.hotbrkm.routersim.simulator.router.properties.RouterProperties;
import io.github.hotbrkm.routersim.simulator.router.service.PacketForwarder;
import io.github.hotbrkm.routersim.simulator.router.service.RouterService;
import io.github.hotbrkm.routersim.simulator.router.shell.CommandInterpreter;
import io.github.hotbrkm.routersim.simulator.router.shell.RouterShell;
import io.github.hotbrkm.routersim.simulator.router.table.RoutingTable;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Paths;
import java.util.List;

@Slf4j
@Configuration
@EnableConfigurationProperties(RouterProperties.class)
public class RouterConfig {

    private static final String SHELL_PROPERTY_PREFIX = "router.shell";

    @Bean
    public RoutingTable routingTable() {
        return new RoutingTable();
    }

    @Bean
    public PacketForwarder packetForwarder(RoutingTable routingTable) {
        return new PacketForwarder(routingTable);
    }

    @Bean(destroyMethod = "close")
    public ActivityLog activityLog(RouterProperties properties) {
        RouterProperties.ActivityLog config = properties.getActivityLog();
        if (!config.isEnabled()) {
            log.info("Activity log is disabled.");
            return ActivityLog.noOp();
        }
        if (!StringUtils.hasText(config.getPath())) {
            throw new IllegalStateException("Property 'router.activity-log.path' is required.");
        }
        return new FileActivityLog(Paths.get(config.getPath()));
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public RouterMetricsRecorder routerMetricsRecorder(MeterRegistry meterRegistry) {
        return new RouterMetricsRecorder(meterRegistry);
    }

    @Bean
    public RouterService routerService(RouterProperties properties,
                                       RoutingTable routingTable,
                                       PacketForwarder packetForwarder,
                                       ActivityLog activityLog,
                                       RouterMetricsRecorder metricsRecorder) {
        RouterService routerService = new RouterService(routingTable, packetForwarder, activityLog, metricsRecorder);
        int loaded = loadStaticRoutes(routerService, properties.getStaticRoutes());
        log.info("Router service is ready with {} static route(s).", loaded);
        return routerService;
    }

    @Bean
    @ConditionalOnProperty(prefix = SHELL_PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public CommandInterpreter commandInterpreter(RouterService routerService) {
        return new CommandInterpreter(routerService, consoleWriter());
    }

    @Bean
    @ConditionalOnProperty(prefix = SHELL_PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public RouterShell routerShell(RouterProperties properties, CommandInterpreter commandInterpreter) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        return new RouterShell(commandInterpreter, in, consoleWriter(), properties.getShell().getPrompt());
    }

    static int loadStaticRoutes(RouterService routerService, List<RouterProperties.StaticRoute> staticRoutes) {
        if (staticRoutes == null) {
            return 0;
        }

        int loaded = 0;
        for (RouterProperties.StaticRoute route : staticRoutes) {
            try {
                routerService.addRoute(route.getNetwork(), route.getGateway(), route.getMetric());
                loaded++;
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid static route '" + route + "': " + e.getMessage(), e);
            }
        }
        return loaded;
    }

    private static PrintWriter consoleWriter() {
        return new PrintWriter(new OutputStreamWriter(System.out, Charset.defaultCharset()), true);
    }
}
