package io.github.hotbrkm.routersim.simulator;

import io.github.hotbrkm.routersim.simulator.router.model.ForwardResult;
import io.github.hotbrkm.routersim.simulator.router.service.RouterService;
import io.github.hotbrkm.routersim.simulator.router.shell.RouterShell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "router.shell.enabled=false",
        "router.activity-log.enabled=false",
        "router.static-routes[0].network=10.0.0.0/8",
        "router.static-routes[0].gateway=10.0.0.1",
        "router.static-routes[0].metric=10",
        "router.static-routes[1].network=10.1.0.0/16",
        "router.static-routes[1].gateway=10.1.0.1",
        "router.static-routes[1].metric=5"
})
@DisplayName("RouterSimulatorApplication context test")
class RouterSimulatorApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private RouterService routerService;

    @Test
    @DisplayName("Loads static routes from configuration and leaves the shell disabled")
    void contextLoadsWithStaticRoutes() {
        assertThat(context.getBeansOfType(RouterShell.class)).isEmpty();
        assertThat(routerService.listRoutes()).extracting(route -> route.network().toString())
                .containsExactly("10.1.0.0/16", "10.0.0.0/8");

        ForwardResult result = routerService.forward("192.168.0.1", "10.1.2.3", "ICMP");
        assertThat(result.decision().gateway()).hasToString("10.1.0.1/32");
    }
}
