package com.company.bookingsync.repository;

import com.company.bookingsync.domain.BookingEvent;
import com.company.bookingsync.domain.enums.EventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.bookingsync.repository.IntegrationRepository.toInstant;

@Repository
@RequiredArgsConstructor
@Slf4j
public class BookingEventRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String WINDOW_PREDICATE = """
        tenant_id = ?
        AND ((scheduled_at BETWEEN ? AND ?) OR (created_at BETWEEN ? AND ?))
        """;

    /**
     * Insert or update on (tenant_id, provider_event_id). Stored invitee data survives
     * a re-ingest without enrichment; cancelled_at is stamped once.
     */
    public void upsert(BookingEvent event) {
        Instant now = Instant.now();

        String sql = """
            INSERT INTO booking_events (
                tenant_id, provider_event_id, provider_event_type_id, event_type_name,
                scheduled_at, created_at, status, invitee_name, invitee_email,
                cancelled_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (tenant_id, provider_event_id) DO UPDATE SET
                provider_event_type_id = EXCLUDED.provider_event_type_id,
                event_type_name = COALESCE(EXCLUDED.event_type_name, booking_events.event_type_name),
                scheduled_at = EXCLUDED.scheduled_at,
                status = EXCLUDED.status,
                invitee_name = COALESCE(EXCLUDED.invitee_name, booking_events.invitee_name),
                invitee_email = COALESCE(EXCLUDED.invitee_email, booking_events.invitee_email),
                cancelled_at = CASE
                    WHEN EXCLUDED.status = 'cancelled'
                        THEN COALESCE(booking_events.cancelled_at, EXCLUDED.cancelled_at)
                    ELSE booking_events.cancelled_at
                END,
                updated_at = EXCLUDED.updated_at
            """;

        EventStatus status = event.getStatus() != null ? event.getStatus() : EventStatus.ACTIVE;
        Instant cancelledAt = status == EventStatus.CANCELLED
                ? (event.getCancelledAt() != null ? event.getCancelledAt() : now)
                : null;

        jdbcTemplate.update(sql,
                event.getTenantId(),
                event.getProviderEventId(),
                event.getProviderEventTypeId(),
                event.getEventTypeName(),
                Timestamp.from(event.getScheduledAt()),
                event.getCreatedAt() != null ? Timestamp.from(event.getCreatedAt()) : null,
                status.getCode(),
                event.getInviteeName(),
                event.getInviteeEmail(),
                cancelledAt != null ? Timestamp.from(cancelledAt) : null,
                Timestamp.from(now)
        );
    }

    public List<String> findEventIdsInWindow(String tenantId, Instant start, Instant end) {
        String sql = "SELECT provider_event_id FROM booking_events WHERE " + WINDOW_PREDICATE;
        Timestamp from = Timestamp.from(start);
        Timestamp to = Timestamp.from(end);
        return jdbcTemplate.queryForList(sql, String.class, tenantId, from, to, from, to);
    }

    public Map<String, EventStatus> findStatusesInWindow(String tenantId, Instant start, Instant end) {
        String sql = "SELECT provider_event_id, status FROM booking_events WHERE " + WINDOW_PREDICATE;
        Timestamp from = Timestamp.from(start);
        Timestamp to = Timestamp.from(end);

        Map<String, EventStatus> statuses = new LinkedHashMap<>();
        jdbcTemplate.query(sql, rs -> {
            statuses.put(rs.getString("provider_event_id"), EventStatus.normalize(rs.getString("status")));
        }, tenantId, from, to, from, to);
        return statuses;
    }

    public long countActiveScheduledBefore(String tenantId, Instant scheduledBefore) {
        String sql = """
            SELECT COUNT(*) FROM booking_events
            WHERE tenant_id = ? AND status = 'active' AND scheduled_at < ?
            """;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, tenantId, Timestamp.from(scheduledBefore));
        return count != null ? count : 0L;
    }

    public long countCreatedSince(String tenantId, Instant since) {
        String sql = """
            SELECT COUNT(*) FROM booking_events
            WHERE tenant_id = ? AND created_at >= ?
            """;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, tenantId, Timestamp.from(since));
        return count != null ? count : 0L;
    }

    public List<BookingEvent> findActiveScheduledBetween(String tenantId, Instant from, Instant to) {
        String sql = """
            SELECT id, tenant_id, provider_event_id, provider_event_type_id, event_type_name,
                   scheduled_at, created_at, status, invitee_name, invitee_email,
                   cancelled_at, updated_at
            FROM booking_events
            WHERE tenant_id = ? AND status = 'active' AND scheduled_at BETWEEN ? AND ?
            ORDER BY scheduled_at ASC
            """;
        return jdbcTemplate.query(sql, new BookingEventRowMapper(),
                tenantId, Timestamp.from(from), Timestamp.from(to));
    }

    private static class BookingEventRowMapper implements RowMapper<BookingEvent> {
        @Override
        public BookingEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return BookingEvent.builder()
                    .id(rs.getLong("id"))
                    .tenantId(rs.getString("tenant_id"))
                    .providerEventId(rs.getString("provider_event_id"))
                    .providerEventTypeId(rs.getString("provider_event_type_id"))
                    .eventTypeName(rs.getString("event_type_name"))
                    .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .status(EventStatus.normalize(rs.getString("status")))
                    .inviteeName(rs.getString("invitee_name"))
                    .inviteeEmail(rs.getString("invitee_email"))
                    .cancelledAt(toInstant(rs.getTimestamp("cancelled_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }
}
