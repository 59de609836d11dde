package com.ekslens.leadmaster.lead.persistence;

import com.ekslens.leadmaster.lead.model.DraftedMessage;
import com.ekslens.leadmaster.lead.model.Lead;
import com.ekslens.leadmaster.lead.model.LeadGroupField;
import com.ekslens.leadmaster.lead.model.LeadIdentity;
import com.ekslens.leadmaster.lead.model.LeadInsertResult;
import com.ekslens.leadmaster.lead.model.LeadStatus;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.SessionStatsSnapshot;
import com.ekslens.leadmaster.lead.model.StoredLead;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class LeadJdbcRepository implements LeadStore {
    private static final RowMapper<StoredLead> STORED_LEAD_MAPPER = (rs, rowNum) -> new StoredLead(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("website"),
        rs.getString("description"),
        rs.getString("source"),
        rs.getString("search_term"),
        rs.getString("industry"),
        rs.getString("extraction_method"),
        rs.getString("location"),
        rs.getString("email"),
        rs.getString("phone"),
        LeadStatus.fromDbValue(rs.getString("status")),
        toInstant(rs.getTimestamp("found_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public LeadJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            return false;
        }
    }

    @Override
    public Optional<Long> findByIdentity(LeadIdentity identity) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", identity.normalizedName())
            .addValue("url", identity.normalizedUrl());
        String sql = identity.hasUrl()
            ? """
                SELECT id
                FROM leads
                WHERE normalized_name = :name OR normalized_url = :url
                ORDER BY id
                LIMIT 1
                """
            : """
                SELECT id
                FROM leads
                WHERE normalized_name = :name
                ORDER BY id
                LIMIT 1
                """;
        List<Long> ids = jdbc.query(sql, params, (rs, rowNum) -> rs.getLong("id"));
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public LeadInsertResult insert(Lead lead, LeadStatus status) {
        LeadIdentity identity = LeadIdentity.of(lead);
        if (identity.normalizedName().isEmpty()) {
            throw new LeadPersistenceException("Lead name is required", null);
        }
        Optional<Long> existing = findByIdentity(identity);
        if (existing.isPresent()) {
            return new LeadInsertResult(existing.get(), false);
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", truncate(lead.displayName().trim(), 500))
            .addValue("normalizedName", identity.normalizedName())
            .addValue("website", truncate(trimToNull(lead.canonicalUrl()), 2000))
            .addValue("normalizedUrl", identity.normalizedUrl())
            .addValue("description", truncate(trimToNull(lead.description()), 4000))
            .addValue("source", truncate(lead.sourceName() == null ? "unknown" : lead.sourceName(), 100))
            .addValue("searchTerm", truncate(lead.searchTermUsed(), 500))
            .addValue("industry", truncate(lead.industryName(), 200))
            .addValue("extractionMethod", truncate(lead.extractionMethod(), 100))
            .addValue("location", truncate(trimToNull(lead.location()), 500))
            .addValue("email", truncate(trimToNull(lead.email()), 320))
            .addValue("phone", truncate(trimToNull(lead.phone()), 64))
            .addValue("status", (status == null ? LeadStatus.PENDING : status).dbValue())
            .addValue("foundAt", toTimestamp(lead.foundAt() == null ? Instant.now() : lead.foundAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO leads (
                        name, normalized_name, website, normalized_url, description, source,
                        search_term, industry, extraction_method, location, email, phone, status, found_at
                    )
                    VALUES (
                        :name, :normalizedName, :website, :normalizedUrl, :description, :source,
                        :searchTerm, :industry, :extractionMethod, :location, :email, :phone, :status, :foundAt
                    )
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } catch (DataIntegrityViolationException e) {
            Optional<Long> raced = findByIdentity(identity);
            if (raced.isPresent()) {
                return new LeadInsertResult(raced.get(), false);
            }
            throw new LeadPersistenceException("Lead insert rejected for " + lead.displayName(), e);
        } catch (DataAccessException e) {
            throw new LeadPersistenceException("Lead insert failed for " + lead.displayName(), e);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new LeadPersistenceException("No id generated for lead " + lead.displayName(), null);
        }
        return new LeadInsertResult(key.longValue(), true);
    }

    @Override
    public List<StoredLead> listRecent(int limit, LeadStatus statusFilter) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        String filter = "";
        if (statusFilter != null) {
            filter = "WHERE status = :status";
            params.addValue("status", statusFilter.dbValue());
        }
        return jdbc.query(
            """
                SELECT id, name, website, description, source, search_term, industry,
                       extraction_method, location, email, phone, status, found_at
                FROM leads
                %s
                ORDER BY found_at DESC, id DESC
                LIMIT :limit
                """.formatted(filter),
            params,
            STORED_LEAD_MAPPER
        );
    }

    @Override
    public Map<String, Long> aggregateCounts(LeadGroupField field) {
        String column = field.column();
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT %1$s AS group_key, COUNT(*) AS total
                FROM leads
                GROUP BY %1$s
                ORDER BY total DESC, group_key
                """.formatted(column),
            (RowCallbackHandler) rs -> {
                String key = rs.getString("group_key");
                counts.put(key == null ? "unknown" : key, rs.getLong("total"));
            }
        );
        return counts;
    }

    @Override
    public long countLeads() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM leads", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long countMessages() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM generated_messages", Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public long insertMessage(DraftedMessage message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("leadId", message.leadId())
            .addValue("content", truncate(message.content(), 8000))
            .addValue("industry", truncate(message.industry(), 200))
            .addValue("generatedAt", toTimestamp(message.generatedAt() == null ? Instant.now() : message.generatedAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO generated_messages (lead_id, content, industry, status, generated_at)
                    VALUES (:leadId, :content, :industry, 'draft', :generatedAt)
                    """,
                params,
                keyHolder,
                new String[] {"id"}
            );
        } catch (DataAccessException e) {
            throw new LeadPersistenceException("Message insert failed for lead " + message.leadId(), e);
        }
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    @Override
    public void recordSession(SessionReport report, String reportPath) {
        SessionStatsSnapshot stats = report.stats();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("industryId", report.industryId())
            .addValue("industry", report.industry())
            .addValue("status", report.status().name())
            .addValue("startedAt", toTimestamp(report.startedAt()))
            .addValue("finishedAt", toTimestamp(report.finishedAt()))
            .addValue("searches", stats.searchesPerformed())
            .addValue("found", stats.leadsFound())
            .addValue("saved", stats.leadsSaved())
            .addValue("duplicates", stats.duplicatesResolved())
            .addValue("rejected", stats.rejected())
            .addValue("drafted", stats.messagesDrafted())
            .addValue("seconds", stats.executionSeconds())
            .addValue("reportPath", truncate(reportPath, 1000));
        jdbc.update(
            """
                INSERT INTO search_sessions (
                    industry_id, industry, status, started_at, finished_at, searches_performed,
                    leads_found, leads_saved, duplicates_resolved, rejected, messages_drafted,
                    execution_seconds, report_path
                )
                VALUES (
                    :industryId, :industry, :status, :startedAt, :finishedAt, :searches,
                    :found, :saved, :duplicates, :rejected, :drafted,
                    :seconds, :reportPath
                )
                """,
            params
        );
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
