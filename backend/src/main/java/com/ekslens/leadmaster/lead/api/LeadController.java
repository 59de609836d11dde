package com.ekslens.leadmaster.lead.api;

import com.ekslens.leadmaster.lead.industry.IndustryPolicy;
import com.ekslens.leadmaster.lead.industry.IndustryPolicyRegistry;
import com.ekslens.leadmaster.lead.model.IndustryChangeResponse;
import com.ekslens.leadmaster.lead.model.IndustryInfo;
import com.ekslens.leadmaster.lead.model.JobLogsResponse;
import com.ekslens.leadmaster.lead.model.JobStatusResponse;
import com.ekslens.leadmaster.lead.model.LeadsOverview;
import com.ekslens.leadmaster.lead.model.ManualLeadResponse;
import com.ekslens.leadmaster.lead.model.SearchRequest;
import com.ekslens.leadmaster.lead.model.SessionReport;
import com.ekslens.leadmaster.lead.model.StartSearchResponse;
import com.ekslens.leadmaster.lead.service.LeadAggregationService;
import com.ekslens.leadmaster.lead.service.LeadService;
import com.ekslens.leadmaster.lead.service.LeadStatusService;
import com.ekslens.leadmaster.lead.service.SearchRequestFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class LeadController {
    private final LeadAggregationService aggregationService;
    private final LeadStatusService statusService;
    private final LeadService leadService;
    private final SearchRequestFactory searchRequestFactory;
    private final IndustryPolicyRegistry industryRegistry;

    public LeadController(
        LeadAggregationService aggregationService,
        LeadStatusService statusService,
        LeadService leadService,
        SearchRequestFactory searchRequestFactory,
        IndustryPolicyRegistry industryRegistry
    ) {
        this.aggregationService = aggregationService;
        this.statusService = statusService;
        this.leadService = leadService;
        this.searchRequestFactory = searchRequestFactory;
        this.industryRegistry = industryRegistry;
    }

    @GetMapping("/status")
    public JobStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/logs")
    public JobLogsResponse logs() {
        return statusService.getLogs();
    }

    @PostMapping("/search/start")
    public StartSearchResponse startSearch(@RequestBody(required = false) SearchApiRequest request) {
        IndustryPolicy policy = request == null || request.industry() == null || request.industry().isBlank()
            ? aggregationService.currentIndustry()
            : industryRegistry.resolve(request.industry());
        SearchRequest searchRequest = searchRequestFactory.create(
            policy,
            request == null ? null : request.cities(),
            request == null ? null : request.keywords(),
            request == null ? null : request.maxSearches(),
            request == null ? null : request.sources()
        );
        return aggregationService.startAsync(searchRequest);
    }

    @PostMapping("/search/stop")
    public Map<String, Object> stopSearch() {
        boolean stopping = aggregationService.stop();
        return Map.of(
            "stopping", stopping,
            "message", stopping ? "Stop requested" : "No search is running"
        );
    }

    @GetMapping("/results")
    public SessionReport results() {
        return statusService.getLastResults()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No search results yet"));
    }

    @GetMapping("/leads/overview")
    public LeadsOverview leadsOverview() {
        return leadService.getOverview();
    }

    @PostMapping("/leads")
    public ManualLeadResponse addLead(@RequestBody ManualLeadRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "name is required");
        }
        return leadService.addManualLead(
            request.name(),
            request.website(),
            request.description(),
            request.location(),
            request.email(),
            request.phone()
        );
    }

    @GetMapping("/industries")
    public List<IndustryInfo> industries() {
        return industryRegistry.describeAll();
    }

    @GetMapping("/industry")
    public IndustryInfo currentIndustry() {
        return IndustryPolicyRegistry.describe(aggregationService.currentIndustry());
    }

    @PostMapping("/industry")
    public IndustryChangeResponse changeIndustry(@RequestBody IndustryChangeRequest request) {
        if (request == null || request.industry() == null || request.industry().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "industry is required");
        }
        boolean known = industryRegistry.isKnown(request.industry());
        IndustryPolicy policy = aggregationService.changeIndustry(request.industry());
        return new IndustryChangeResponse(request.industry(), !known, IndustryPolicyRegistry.describe(policy));
    }
}
