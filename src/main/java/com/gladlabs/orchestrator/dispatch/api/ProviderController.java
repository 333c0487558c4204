package com.gladlabs.orchestrator.dispatch.api;

import com.gladlabs.orchestrator.core.routing.ModelRouter;
import com.gladlabs.orchestrator.core.routing.ProviderOverview;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Registered providers with their liveness and call statistics.
 */
@RestController
@RequestMapping("/api/v1/providers")
public class ProviderController {

    private final ModelRouter modelRouter;

    public ProviderController(ModelRouter modelRouter) {
        this.modelRouter = modelRouter;
    }

    @GetMapping
    public List<ProviderOverview> listProviders(@RequestParam(defaultValue = "false") boolean probe) {
        return modelRouter.describeProviders(probe);
    }
}
