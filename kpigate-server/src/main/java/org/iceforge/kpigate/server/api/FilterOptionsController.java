package org.iceforge.kpigate.server.api;

import org.iceforge.kpigate.server.service.KpiQueryService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;

/**
 * Distinct values for dashboard dropdowns, e.g. every state code in the volume table.
 */
@RestController
@RequestMapping("/api/filters")
public class FilterOptionsController {

    private final KpiQueryService queryService;

    public FilterOptionsController(KpiQueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService);
    }

    @PostMapping
    public KpiApiModels.FilterOptionsResponse options(@RequestBody KpiApiModels.FilterOptionsRequest req) {
        List<KpiApiModels.Option> options = queryService.filterOptions(req.dimension(), req.table()).stream()
                .map(v -> new KpiApiModels.Option(v, v))
                .toList();
        return new KpiApiModels.FilterOptionsResponse(true, options);
    }
}
