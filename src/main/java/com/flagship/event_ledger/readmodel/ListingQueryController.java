package com.flagship.event_ledger.readmodel;

import com.flagship.event_ledger.listing.ListingNotFoundException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-model queries. Served entirely from {@code listings_read}.
 */
@RestController
@RequestMapping("/api/listings")
@RequiredArgsConstructor
public class ListingQueryController {

    private final MaterializedViewService materializedViewService;

    @GetMapping("/{id}/statistics")
    public ResponseEntity<ListingStatistics> getStatistics(@PathVariable("id") UUID id) {
        return materializedViewService.getStatistics(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ListingNotFoundException(id));
    }

    @GetMapping("/top")
    public List<ListingStatistics> getTop(@RequestParam(name = "limit", defaultValue = "10") @Min(1) @Max(100) int limit) {
        return materializedViewService.getTopByRegistration(limit);
    }
}
