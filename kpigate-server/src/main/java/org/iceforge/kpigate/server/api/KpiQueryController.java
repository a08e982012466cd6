package org.iceforge.kpigate.server.api;

import org.iceforge.kpigate.request.KpiQuery;
import org.iceforge.kpigate.request.KpiRequestException;
import org.iceforge.kpigate.server.config.KpiGatewayProperties;
import org.iceforge.kpigate.server.service.KpiQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Objects;

@RestController
@RequestMapping("/api/query")
public class KpiQueryController {

    private final KpiQueryService queryService;
    private final KpiGatewayProperties gatewayProps;

    public KpiQueryController(KpiQueryService queryService, KpiGatewayProperties gatewayProps) {
        this.queryService = Objects.requireNonNull(queryService);
        this.gatewayProps = Objects.requireNonNull(gatewayProps);
    }

    @GetMapping
    public KpiApiModels.StatusResponse status() {
        return new KpiApiModels.StatusResponse(true, "operational", gatewayProps.apiVersion(), "Use POST to query KPIs");
    }

    @PostMapping
    public ResponseEntity<?> query(@RequestBody KpiApiModels.KpiRequest req) {
        // transport check; never touches the warehouse
        if (req.isPing()) {
            return ResponseEntity.ok(new KpiApiModels.PingResponse(true, "ping", gatewayProps.apiVersion()));
        }
        if (req.contractVersion() != null && !KpiApiModels.CONTRACT_VERSION.equals(req.contractVersion())) {
            throw new KpiRequestException("Unsupported contract_version '" + req.contractVersion() + "'");
        }

        KpiQuery query = KpiQuery.of(
                req.kpi(),
                req.groupBy(),
                req.scope(),
                req.maxMonth(),
                req.filters() == null ? null : req.filters().toKpiFilters()
        );
        KpiQueryService.KpiQueryOutcome out = queryService.query(query);

        return ResponseEntity.ok(new KpiApiModels.KpiResponse(
                true,
                out.rawResult(),
                out.result().rows(),
                gatewayProps.apiVersion(),
                new KpiApiModels.Meta(out.sql(), out.statementId())
        ));
    }
}
