package com.transitgate.interfaces.api.quality;

import com.transitgate.application.quality.QualityGateAppService;
import com.transitgate.domain.dataset.model.Dataset;
import com.transitgate.domain.quality.model.QualityGateResult;
import com.transitgate.domain.quality.model.SeverityPolicy;
import com.transitgate.interfaces.api.dto.QualityGateRunRequest;
import com.transitgate.interfaces.api.dto.QualityGateRunResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/quality-gate")
@RequiredArgsConstructor
public class QualityGateController {

    private final QualityGateAppService appService;

    /**
     * Run the gate on an inline dataset. A HALT is a normal 200 response carrying the decision.
     */
    @PostMapping("/runs")
    public ResponseEntity<QualityGateRunResponse> run(@Valid @RequestBody QualityGateRunRequest request) {
        Dataset dataset = Dataset.fromRows(request.name(), request.records());

        Map<String, Dataset> references = new LinkedHashMap<>();
        if (request.referenceTables() != null) {
            request.referenceTables().forEach((name, rows) -> references.put(name, Dataset.fromRows(name, rows)));
        }

        SeverityPolicy policy = request.policy() != null
                ? request.policy().mergeInto(appService.defaultPolicy())
                : appService.defaultPolicy();

        QualityGateResult result = appService.run(dataset.withReferenceTables(references), policy);
        return ResponseEntity.ok(QualityGateRunResponse.from(result));
    }
}
