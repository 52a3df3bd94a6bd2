package com.designauditor.crawl.api;

import com.designauditor.crawl.model.DomainAnalysisRequest;
import com.designauditor.crawl.model.DomainAnalysisStatus;
import com.designauditor.crawl.report.DomainAnalysisReport;
import com.designauditor.crawl.report.ReportExportService;
import com.designauditor.crawl.service.DomainAnalysisService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final DomainAnalysisService analysisService;
    private final ReportExportService reportService;

    public AnalysisController(DomainAnalysisService analysisService, ReportExportService reportService) {
        this.analysisService = analysisService;
        this.reportService = reportService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> start(@RequestBody DomainAnalysisRequest request) {
        String jobId = analysisService.startDomainAnalysis(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", jobId));
    }

    @GetMapping
    public List<DomainAnalysisStatus> list() {
        return analysisService.listJobs();
    }

    @PostMapping("/{jobId}/cancel")
    public DomainAnalysisStatus cancel(@PathVariable("jobId") String jobId) {
        return analysisService.cancelDomainAnalysis(jobId);
    }

    @GetMapping("/{jobId}/status")
    public DomainAnalysisStatus status(@PathVariable("jobId") String jobId) {
        return analysisService.getStatus(jobId);
    }

    @GetMapping("/{jobId}/result")
    public DomainAnalysisReport result(@PathVariable("jobId") String jobId) {
        return analysisService.getResult(jobId);
    }

    @PostMapping("/{jobId}/failed-pages/retry")
    public ResponseEntity<DomainAnalysisStatus> retryFailedPage(
        @PathVariable("jobId") String jobId,
        @RequestParam("url") String url
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(analysisService.retryFailedPage(jobId, url));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> reset(@PathVariable("jobId") String jobId) {
        analysisService.resetJob(jobId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{jobId}/export/colors.csv")
    public ResponseEntity<String> exportColors(@PathVariable("jobId") String jobId) {
        DomainAnalysisReport report = analysisService.getResult(jobId);
        return csv("colors-" + jobId + ".csv", reportService.colorTableCsv(report.colorTable()));
    }

    @GetMapping("/{jobId}/export/failed-pages.csv")
    public ResponseEntity<String> exportFailedPages(@PathVariable("jobId") String jobId) {
        DomainAnalysisReport report = analysisService.getResult(jobId);
        return csv("failed-pages-" + jobId + ".csv", reportService.failedPagesCsv(report.failedPages()));
    }

    private ResponseEntity<String> csv(String filename, String body) {
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
            .body(body);
    }
}
