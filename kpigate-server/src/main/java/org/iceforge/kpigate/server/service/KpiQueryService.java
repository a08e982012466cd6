package org.iceforge.kpigate.server.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.kpigate.request.KpiQuery;
import org.iceforge.kpigate.server.config.StatementServiceProperties;
import org.iceforge.kpigate.server.execution.StatementExecutionException;
import org.iceforge.kpigate.server.execution.StatementJob;
import org.iceforge.kpigate.server.execution.StatementPoller;
import org.iceforge.kpigate.server.execution.StatementState;
import org.iceforge.kpigate.server.result.QueryResult;
import org.iceforge.kpigate.server.result.ResultNormalizer;
import org.iceforge.kpigate.sql.FilterOptionsStatement;
import org.iceforge.kpigate.sql.StatementAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Compile, execute, normalize. One statement per call, sequential on the calling thread.
 */
@Service
public class KpiQueryService {
    private static final Logger log = LoggerFactory.getLogger(KpiQueryService.class);

    private final StatementPoller poller;
    private final StatementServiceProperties props;

    public KpiQueryService(StatementPoller poller, StatementServiceProperties props) {
        this.poller = Objects.requireNonNull(poller);
        this.props = Objects.requireNonNull(props);
    }

    public record KpiQueryOutcome(
            String sql,
            String statementId,
            JsonNode rawResult,
            QueryResult result
    ) {}

    public KpiQueryOutcome query(KpiQuery query) {
        Objects.requireNonNull(query, "query");
        String sql = StatementAssembler.assemble(query);
        log.info("KPI query kpi={} groupBy={} scope={} month={}",
                query.kpi().key(), query.groupBy().wireName(), query.scope(), query.referenceMonth());

        StatementJob job = execute(sql);
        return new KpiQueryOutcome(sql, job.statementId(), job.result(), ResultNormalizer.normalize(job.result()));
    }

    public List<String> filterOptions(String dimension, String table) {
        String sql = FilterOptionsStatement.assemble(dimension, table);
        StatementJob job = execute(sql);
        return ResultNormalizer.firstColumn(job.result());
    }

    private StatementJob execute(String sql) {
        if (!props.isConfigured()) {
            throw new StatementServiceNotConfiguredException();
        }
        StatementJob job = poller.run(sql);
        if (job.state() != StatementState.SUCCEEDED) {
            throw new StatementExecutionException(job);
        }
        return job;
    }
}
