package com.pricetrack.ingest.api;

import com.pricetrack.ingest.model.Job;
import com.pricetrack.ingest.model.JobStatus;
import com.pricetrack.ingest.model.JobSubmitRequest;
import com.pricetrack.ingest.model.JobSubmitResponse;
import com.pricetrack.ingest.model.JobView;
import com.pricetrack.ingest.model.PriceHistoryEntry;
import com.pricetrack.ingest.model.Product;
import com.pricetrack.ingest.model.StatusResponse;
import com.pricetrack.ingest.service.JobOrchestratorService;
import com.pricetrack.ingest.service.ProductQueryService;
import com.pricetrack.ingest.service.TrackerStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class JobController {
    private final JobOrchestratorService orchestratorService;
    private final ProductQueryService productQueryService;
    private final TrackerStatusService statusService;

    public JobController(
        JobOrchestratorService orchestratorService,
        ProductQueryService productQueryService,
        TrackerStatusService statusService
    ) {
        this.orchestratorService = orchestratorService;
        this.productQueryService = productQueryService;
        this.statusService = statusService;
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobSubmitResponse submitJob(@RequestBody(required = false) JobSubmitRequest request) {
        String jobId = orchestratorService.submit(request == null ? null : request.webCode());
        return new JobSubmitResponse(jobId, JobStatus.PENDING);
    }

    @GetMapping("/jobs/{jobId}")
    public JobView getJob(@PathVariable("jobId") String jobId) {
        return orchestratorService.toView(orchestratorService.getJob(jobId));
    }

    @GetMapping("/jobs")
    public List<JobView> listJobs(@RequestParam(name = "limit", required = false) Integer limit) {
        List<Job> jobs = orchestratorService.listJobs(limit);
        return jobs.stream().map(orchestratorService::toView).toList();
    }

    @GetMapping("/products/{webCode}")
    public Product getProduct(@PathVariable("webCode") String webCode) {
        return productQueryService.findProduct(webCode)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Product not found: " + webCode));
    }

    @GetMapping("/products/{webCode}/history")
    public List<PriceHistoryEntry> getPriceHistory(@PathVariable("webCode") String webCode) {
        return productQueryService.priceHistory(webCode);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return statusService.getStatus();
    }
}
