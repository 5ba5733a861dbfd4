package io.github.hotbrkm.routersim.simulator.router.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the router simulator.
 * <p>
 * These properties are loaded from the {@code router} prefix in application.yml.
 * </p>
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * router:
 *   activity-log:
 *     enabled: true
 *     path: router.log
 *   shell:
 *     enabled: true
 *     prompt: "> "
 *   static-routes:
 *     - network: 10.0.0.0/8
 *       gateway: 10.0.0.1
 *       metric: 10
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    /**
     * Activity log configuration.
     */
    @NestedConfigurationProperty
    private ActivityLog activityLog = new ActivityLog();

    /**
     * Interactive shell configuration.
     */
    @NestedConfigurationProperty
    private Shell shell = new Shell();

    /**
     * Routes added to the table at startup, in order.
     */
    private List<StaticRoute> staticRoutes = new ArrayList<>();

    @Getter
    @Setter
    public static class ActivityLog {
        /**
         * Whether activity records are written to a file.
         */
        private boolean enabled = true;

        /**
         * File the activity records are appended to.
         */
        private String path = "router.log";
    }

    @Getter
    @Setter
    public static class Shell {
        /**
         * Whether the interactive shell reads commands from standard input.
         */
        private boolean enabled = true;

        /**
         * Prompt printed before each command.
         */
        private String prompt = "> ";
    }

    @Getter
    @Setter
    public static class StaticRoute {
        private String network;
        private String gateway;
        private int metric;

        @Override
        public String toString() {
            return network + " " + gateway + " " + metric;
        }
    }
}
