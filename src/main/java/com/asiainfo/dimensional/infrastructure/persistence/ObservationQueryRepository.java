package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.domain.model.LatestObservation;
import com.asiainfo.dimensional.domain.model.TimeSpan;
import com.asiainfo.dimensional.domain.query.AggregateRow;
import com.asiainfo.dimensional.domain.query.ComposedQuery;
import com.asiainfo.dimensional.domain.query.QueryComposer;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 执行 QueryComposer 生成的 SQL 并映射结果
 */
@ApplicationScoped
public class ObservationQueryRepository {

    private static final Logger log = LoggerFactory.getLogger(ObservationQueryRepository.class);

    public List<AggregateRow> aggregate(Connection conn, ComposedQuery query) throws SQLException {
        log.debug("[Query] {} SQL:\n{}\nparams={}", query.mode(), query.sql(), query.params());
        List<AggregateRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            SqlSupport.bind(stmt, query.params());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapAggregate(rs, query));
                }
            }
        }
        return rows;
    }

    public Optional<LatestObservation> latest(Connection conn, ComposedQuery query) throws SQLException {
        log.debug("[Query] latest SQL:\n{}\nparams={}", query.sql(), query.params());
        try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            SqlSupport.bind(stmt, query.params());
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new LatestObservation(
                            RowMappers.instant(rs, QueryComposer.COL_TIME_START),
                            rs.getDouble(QueryComposer.COL_VALUE),
                            RowMappers.instant(rs, "ingested_ts")));
                }
            }
        }
        return Optional.empty();
    }

    public TimeSpan availability(Connection conn, ComposedQuery query) throws SQLException {
        log.debug("[Query] availability SQL:\n{}\nparams={}", query.sql(), query.params());
        try (PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            SqlSupport.bind(stmt, query.params());
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new TimeSpan(RowMappers.instant(rs, "min_time_start_ts"),
                            RowMappers.instant(rs, "max_time_start_ts"));
                }
            }
        }
        return TimeSpan.empty();
    }

    private AggregateRow mapAggregate(ResultSet rs, ComposedQuery query) throws SQLException {
        List<String> groupValues = new ArrayList<>(query.groupColumns());
        for (int i = 0; i < query.groupColumns(); i++) {
            groupValues.add(rs.getString("group_" + i));
        }
        long metricId = rs.getLong(QueryComposer.COL_METRIC_ID);
        if (!query.partials()) {
            return new AggregateRow(metricId, groupValues, null,
                    RowMappers.nullableDouble(rs, QueryComposer.COL_VALUE), null, null, null, null);
        }
        Instant timeStart = RowMappers.instant(rs, QueryComposer.COL_TIME_START);
        return switch (query.aggregation()) {
            case AVG -> new AggregateRow(metricId, groupValues, timeStart, null,
                    RowMappers.nullableDouble(rs, QueryComposer.COL_SUM),
                    RowMappers.nullableLong(rs, QueryComposer.COL_COUNT), null, null);
            case MIN -> new AggregateRow(metricId, groupValues, timeStart, null, null, null,
                    RowMappers.nullableDouble(rs, QueryComposer.COL_MIN), null);
            case MAX -> new AggregateRow(metricId, groupValues, timeStart, null, null, null, null,
                    RowMappers.nullableDouble(rs, QueryComposer.COL_MAX));
            case SUM, COUNT -> new AggregateRow(metricId, groupValues, timeStart, null,
                    RowMappers.nullableDouble(rs, QueryComposer.COL_SUM), null, null, null);
        };
    }
}
