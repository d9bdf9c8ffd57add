package com.company.bookingsync.remote.calendly;

import com.company.bookingsync.config.SyncProperties;
import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.exception.TenantSyncException;
import com.company.bookingsync.remote.AccessToken;
import com.company.bookingsync.remote.AccessTokenProvider;
import com.company.bookingsync.remote.PageLimitExceededException;
import com.company.bookingsync.remote.RateLimitedException;
import com.company.bookingsync.remote.RemoteApiException;
import com.company.bookingsync.remote.RemoteEvent;
import com.company.bookingsync.remote.RemoteEventClient;
import com.company.bookingsync.remote.RemoteEventDetail;
import com.company.bookingsync.service.ratelimit.RateLimitCoordinator;
import com.company.bookingsync.service.ratelimit.UsageSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class CalendlyClient implements RemoteEventClient {

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final RestClient restClient;
    private final AccessTokenProvider accessTokenProvider;
    private final RateLimitCoordinator rateLimitCoordinator;
    private final SyncProperties.Calendly settings;
    private final Clock clock;

    public CalendlyClient(RestClient calendlyRestClient,
                          AccessTokenProvider accessTokenProvider,
                          RateLimitCoordinator rateLimitCoordinator,
                          SyncProperties properties,
                          Clock clock) {
        this.restClient = calendlyRestClient;
        this.accessTokenProvider = accessTokenProvider;
        this.rateLimitCoordinator = rateLimitCoordinator;
        this.settings = properties.getCalendly();
        this.clock = clock;
    }

    @Override
    public Provider provider() {
        return Provider.CALENDLY;
    }

    @Override
    public List<RemoteEvent> listEvents(String tenantId, Instant windowStart, Instant windowEnd) {
        return listScheduled(tenantId, windowStart, windowEnd);
    }

    /**
     * Calendly cannot filter on creation time, so list events scheduled up to the
     * lookahead past the window end and keep those created inside the window.
     */
    @Override
    public List<RemoteEvent> listEventsCreatedBetween(String tenantId, Instant windowStart, Instant windowEnd) {
        return listScheduled(tenantId, windowStart, windowEnd.plus(settings.getCreatedLookahead())).stream()
                .filter(event -> event.createdBetween(windowStart, windowEnd))
                .toList();
    }

    /**
     * The lookahead listing already contains every event scheduled in the window, so both
     * query shapes are answered from a single pass.
     */
    @Override
    public List<RemoteEvent> listWindowEvents(String tenantId, Instant windowStart, Instant windowEnd) {
        return listScheduled(tenantId, windowStart, windowEnd.plus(settings.getCreatedLookahead())).stream()
                .filter(event -> event.scheduledBetween(windowStart, windowEnd)
                        || event.createdBetween(windowStart, windowEnd))
                .toList();
    }

    /**
     * Every page of events starting in {@code [from, to]}, oldest start first.
     *
     * @throws PageLimitExceededException when more than {@code max-pages} pages would be needed
     */
    private List<RemoteEvent> listScheduled(String tenantId, Instant from, Instant to) {
        AccessToken token = resolveToken(tenantId);

        URI next = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path("/scheduled_events")
                .queryParam("user", token.ownerUri())
                .queryParam("min_start_time", from.toString())
                .queryParam("max_start_time", to.toString())
                .queryParam("count", settings.getPageSize())
                .queryParam("sort", "start_time:asc")
                .encode()
                .build()
                .toUri();

        List<RemoteEvent> events = new ArrayList<>();
        int pages = 0;
        while (next != null) {
            if (pages == settings.getMaxPages()) {
                log.warn("Calendly listing for tenant {} exceeds {} pages, window [{}, {}] not read in full",
                        tenantId, pages, from, to);
                throw new PageLimitExceededException(pages, "Calendly listing for tenant " + tenantId
                        + " exceeds " + pages + " pages");
            }
            if (pages > 0) {
                rateLimitCoordinator.acquireSubRequest();
            }
            CalendlyPayloads.EventPage page = get(next, token, CalendlyPayloads.EventPage.class);
            pages++;
            if (page == null) {
                break;
            }
            if (page.collection() != null) {
                for (CalendlyPayloads.EventResource resource : page.collection()) {
                    toRemoteEvent(resource).ifPresent(events::add);
                }
            }
            String nextPage = page.pagination() != null ? page.pagination().nextPage() : null;
            next = nextPage != null && !nextPage.isBlank() ? URI.create(nextPage) : null;
        }

        log.debug("Fetched {} Calendly events for tenant {} scheduled in [{}, {}]",
                events.size(), tenantId, from, to);
        return events;
    }

    @Override
    public RemoteEventDetail getEventDetail(String tenantId, String eventId) {
        AccessToken token = resolveToken(tenantId);
        URI uri = URI.create(eventUri(eventId) + "/invitees");

        CalendlyPayloads.InviteePage page = get(uri, token, CalendlyPayloads.InviteePage.class);
        if (page == null || page.collection() == null || page.collection().isEmpty()) {
            return RemoteEventDetail.EMPTY;
        }
        CalendlyPayloads.Invitee invitee = page.collection().get(0);
        return new RemoteEventDetail(invitee.name(), invitee.email());
    }

    @Override
    public Optional<RemoteEvent> fetchEvent(String tenantId, String eventId) {
        AccessToken token = resolveToken(tenantId);
        try {
            CalendlyPayloads.EventEnvelope envelope =
                    get(URI.create(eventUri(eventId)), token, CalendlyPayloads.EventEnvelope.class);
            if (envelope == null || envelope.resource() == null) {
                return Optional.empty();
            }
            return toRemoteEvent(envelope.resource());
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private AccessToken resolveToken(String tenantId) {
        AccessToken token = accessTokenProvider.findAccessToken(tenantId, Provider.CALENDLY)
                .orElseThrow(() -> new TenantSyncException(tenantId, "No Calendly access token for tenant " + tenantId));
        if (token.isExpiredAt(clock.instant())) {
            throw new TenantSyncException(tenantId, "Calendly access token expired for tenant " + tenantId);
        }
        if (token.ownerUri() == null || token.ownerUri().isBlank()) {
            throw new TenantSyncException(tenantId, "Calendly user is unknown for tenant " + tenantId);
        }
        return token;
    }

    private String eventUri(String eventId) {
        if (eventId.startsWith("http://") || eventId.startsWith("https://")) {
            return eventId;
        }
        return settings.getBaseUrl() + "/scheduled_events/" + eventId;
    }

    private Optional<RemoteEvent> toRemoteEvent(CalendlyPayloads.EventResource resource) {
        try {
            return Optional.of(RemoteEvent.of(
                    resource.uri(),
                    resource.eventType(),
                    resource.name(),
                    resource.startTime(),
                    resource.createdAt(),
                    resource.status()
            ));
        } catch (RemoteApiException e) {
            log.warn("Skipping malformed Calendly event: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T get(URI uri, AccessToken token, Class<T> bodyType) {
        try {
            return restClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.token())
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        Double usage = UsageSignal.usagePercent(
                                response.getHeaders().getFirst(LIMIT_HEADER),
                                response.getHeaders().getFirst(REMAINING_HEADER));

                        if (response.getStatusCode().is2xxSuccessful()) {
                            rateLimitCoordinator.reportUsage(new UsageSignal(status, usage, false));
                            return response.bodyTo(bodyType);
                        }

                        String body = readBody(response);
                        boolean rateLimitBody = (status == 400 || status == 403)
                                && UsageSignal.bodyMentionsRateLimit(body);
                        UsageSignal signal = new UsageSignal(status, usage, rateLimitBody);
                        rateLimitCoordinator.reportUsage(signal);

                        if (signal.isHardLimit()) {
                            throw new RateLimitedException(signal, "Calendly rate limit hit on " + uri.getPath());
                        }
                        throw new RemoteApiException(status, "Calendly returned " + status + " on " + uri.getPath());
                    });
        } catch (ResourceAccessException e) {
            throw new RemoteApiException(0, "Calendly unreachable: " + e.getMessage(), e);
        }
    }

    private static String readBody(ClientHttpResponse response) throws IOException {
        return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
    }
}
