package at.totenbilder.search.controller;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.result.Result;
import at.totenbilder.search.common.convention.result.Results;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.JobStatus;
import at.totenbilder.search.dto.PayloadUpdateRequest;
import at.totenbilder.search.dto.ReconciliationSummary;
import at.totenbilder.search.service.PayloadSyncService;
import at.totenbilder.search.service.ReconciliationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Consistency endpoints: payload sync and the reconciliation report
 */
@RestController
@RequestMapping("/api")
public class PayloadController {

    @Autowired
    private PayloadSyncService payloadSyncService;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private ImageSearchProperties properties;

    /**
     * Copies nid/delta from the metadata table into the index, in the background
     * POST /api/update-payload
     */
    @PostMapping("/update-payload")
    public Result<JobStatus> updatePayload(@RequestBody(required = false) PayloadUpdateRequest request) {
        if (request == null) {
            throw new ClientException("Specify filename or all=true", SearchErrorCode.PARAM_EMPTY);
        }
        return Results.success(payloadSyncService.submitSync(request.getFilename(), request.isAll()));
    }

    /**
     * GET /api/missing-in-index
     */
    @GetMapping("/missing-in-index")
    public Result<ReconciliationSummary> missingInIndex() {
        return Results.success(ReconciliationSummary.of(
            reconciliationService.reconcile(),
            properties.getReconciliation().getSampleLimit()));
    }
}
