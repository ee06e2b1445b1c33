package com.flagship.journal_ledger.journal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC persistence for journal entries and their lines.
 *
 * Lines are only ever inserted. Entry rows change only through the two state
 * transitions, and the database rejects anything else.
 */
@Repository
@Slf4j
public class JournalEntryStore {

    private static final String SELECT_ENTRY =
        "SELECT id, entry_number, source_type, source_id, reference, entry_date, description, status, " +
        "total_debit, total_credit, created_by, created_at, posted_at, reversal_of_id, reversed_by_id, " +
        "reversed_at, reversed_by, reversal_reason FROM journal_entries";

    private static final String SELECT_LINE =
        "SELECT id, journal_entry_id, line_number, account_id, description, debit_amount, credit_amount " +
        "FROM journal_lines";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JournalEntryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * Inserts the entry header and all of its lines.
     */
    public void insert(JournalEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, entry_number, source_type, source_id, reference, entry_date, " +
            "description, status, total_debit, total_credit, created_by, created_at, posted_at, reversal_of_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getEntryNumber(),
            entry.getSourceType().name(),
            entry.getSourceId(),
            entry.getReference(),
            Date.valueOf(entry.getEntryDate()),
            entry.getDescription(),
            entry.getStatus().name(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getCreatedBy(),
            toTimestamp(entry.getCreatedAt()),
            toTimestamp(entry.getPostedAt()),
            entry.getReversalOfId()
        );

        List<Object[]> lineArgs = new ArrayList<>();
        for (JournalLine line : entry.getLines()) {
            lineArgs.add(new Object[] {
                line.getId(),
                entry.getId(),
                line.getLineNumber(),
                line.getAccountId(),
                line.getDescription(),
                line.getDebitAmount(),
                line.getCreditAmount()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (id, journal_entry_id, line_number, account_id, description, " +
            "debit_amount, credit_amount) VALUES (?, ?, ?, ?, ?, ?, ?)",
            lineArgs
        );

        log.debug("Inserted journal entry {} with {} lines", entry.getEntryNumber(), lineArgs.size());
    }

    public void markPosted(JournalEntry entry) {
        jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, posted_at = ? WHERE id = ?",
            entry.getStatus().name(),
            toTimestamp(entry.getPostedAt()),
            entry.getId()
        );
    }

    public void markReversed(JournalEntry entry) {
        jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, reversed_by_id = ?, reversed_at = ?, reversed_by = ?, " +
            "reversal_reason = ? WHERE id = ?",
            entry.getStatus().name(),
            entry.getReversedById(),
            toTimestamp(entry.getReversedAt()),
            entry.getReversedBy(),
            entry.getReversalReason(),
            entry.getId()
        );
    }

    public Optional<JournalEntry> findById(UUID id) {
        return loadWithLines(jdbcTemplate.query(SELECT_ENTRY + " WHERE id = ?", entryRowMapper(), id))
            .stream().findFirst();
    }

    /**
     * Reads the entry and holds its row lock until the transaction ends.
     */
    public Optional<JournalEntry> findByIdForUpdate(UUID id) {
        return loadWithLines(jdbcTemplate.query(SELECT_ENTRY + " WHERE id = ? FOR UPDATE", entryRowMapper(), id))
            .stream().findFirst();
    }

    /**
     * The entry currently representing a source record, ignoring reversed ones.
     */
    public Optional<JournalEntry> findLiveBySource(SourceType sourceType, long sourceId) {
        return loadWithLines(jdbcTemplate.query(
            SELECT_ENTRY + " WHERE source_type = ? AND source_id = ? AND status <> 'REVERSED'",
            entryRowMapper(), sourceType.name(), sourceId)).stream().findFirst();
    }

    public List<JournalEntry> findBySource(SourceType sourceType, long sourceId, Collection<JournalStatus> statuses) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceType", sourceType.name())
            .addValue("sourceId", sourceId)
            .addValue("statuses", statuses.stream().map(Enum::name).toList());
        return loadWithLines(namedJdbcTemplate.query(
            SELECT_ENTRY + " WHERE source_type = :sourceType AND source_id = :sourceId " +
            "AND status IN (:statuses) ORDER BY created_at, entry_number",
            params, entryRowMapper()));
    }

    private List<JournalEntry> loadWithLines(List<JournalEntry> headers) {
        if (headers.isEmpty()) {
            return headers;
        }
        Map<UUID, List<JournalLine>> linesByEntry = new LinkedHashMap<>();
        headers.forEach(h -> linesByEntry.put(h.getId(), new ArrayList<>()));

        namedJdbcTemplate.query(
            SELECT_LINE + " WHERE journal_entry_id IN (:ids) ORDER BY journal_entry_id, line_number",
            new MapSqlParameterSource("ids", linesByEntry.keySet()),
            lineRowMapper()
        ).forEach(line -> linesByEntry.get(line.getJournalEntryId()).add(line));

        return headers.stream().map(h -> withLines(h, linesByEntry.get(h.getId()))).toList();
    }

    private static JournalEntry withLines(JournalEntry h, List<JournalLine> lines) {
        return new JournalEntry(h.getId(), h.getEntryNumber(), h.getSourceType(), h.getSourceId(),
            h.getReference(), h.getEntryDate(), h.getDescription(), h.getStatus(), h.getTotalDebit(),
            h.getTotalCredit(), h.getCreatedBy(), h.getCreatedAt(), h.getPostedAt(), h.getReversalOfId(),
            h.getReversedById(), h.getReversedAt(), h.getReversedBy(), h.getReversalReason(), List.copyOf(lines));
    }

    private static RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            long sourceId = rs.getLong("source_id");
            boolean hasSource = !rs.wasNull();
            return new JournalEntry(
                UUID.fromString(rs.getString("id")),
                rs.getString("entry_number"),
                SourceType.valueOf(rs.getString("source_type")),
                hasSource ? sourceId : null,
                rs.getString("reference"),
                rs.getDate("entry_date").toLocalDate(),
                rs.getString("description"),
                JournalStatus.valueOf(rs.getString("status")),
                rs.getBigDecimal("total_debit"),
                rs.getBigDecimal("total_credit"),
                rs.getString("created_by"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("posted_at")),
                toUuid(rs.getString("reversal_of_id")),
                toUuid(rs.getString("reversed_by_id")),
                toInstant(rs.getTimestamp("reversed_at")),
                rs.getString("reversed_by"),
                rs.getString("reversal_reason"),
                List.of()
            );
        };
    }

    static RowMapper<JournalLine> lineRowMapper() {
        return (rs, rowNum) -> new JournalLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("journal_entry_id")),
            rs.getInt("line_number"),
            UUID.fromString(rs.getString("account_id")),
            rs.getString("description"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount")
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static UUID toUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
