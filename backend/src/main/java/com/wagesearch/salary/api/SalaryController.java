package com.wagesearch.salary.api;

import com.wagesearch.salary.model.IngestionSummary;
import com.wagesearch.salary.model.SalarySearchResponse;
import com.wagesearch.salary.model.StatusResponse;
import com.wagesearch.salary.service.CompensationIngestionService;
import com.wagesearch.salary.service.SalaryQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SalaryController {
    private final SalaryQueryService salaryQueryService;
    private final CompensationIngestionService ingestionService;

    public SalaryController(SalaryQueryService salaryQueryService, CompensationIngestionService ingestionService) {
        this.salaryQueryService = salaryQueryService;
        this.ingestionService = ingestionService;
    }

    @GetMapping("/salaries")
    public SalarySearchResponse searchSalaries(
        @RequestParam(name = "title", required = false, defaultValue = "") String title,
        @RequestParam(name = "location", required = false, defaultValue = "") String location,
        @RequestParam(name = "records", required = false) Integer records
    ) {
        return salaryQueryService.search(title, location, records);
    }

    @PostMapping("/ingest")
    public IngestionSummary ingest(
        @RequestParam(name = "replace", required = false, defaultValue = "false") boolean replace
    ) {
        return ingestionService.ingest(replace);
    }

    @GetMapping("/status")
    public StatusResponse getStatus() {
        return salaryQueryService.getStatus();
    }
}
