package com.govledger.controller;

import com.govledger.dto.ApiResponses;
import com.govledger.event.NotificationFeed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read access to the recent-notification feed.
 */
@RestController
@RequestMapping("/events")
@Tag(name = "Events", description = "Recent ProposalCreated / Voted / ProposalClosed notifications")
public class EventController {

    private final NotificationFeed notificationFeed;

    public EventController(NotificationFeed notificationFeed) {
        this.notificationFeed = notificationFeed;
    }

    @GetMapping
    @Operation(summary = "Recent events", description = "Newest notifications last; bounded by the feed capacity")
    public ResponseEntity<List<ApiResponses.EventResponse>> recent(
            @Parameter(description = "Maximum number of events") @RequestParam(defaultValue = "50") int limit) {
        List<ApiResponses.EventResponse> events = notificationFeed.recent(limit)
                .stream()
                .map(ApiResponses.EventResponse::new)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }
}
