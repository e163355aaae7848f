package com.calai.nutrilabel.nutrient.controller;

import com.calai.nutrilabel.nutrient.reconcile.NutrientReconciliationJob;
import com.calai.nutrilabel.nutrient.reconcile.ReconcileRequest;
import com.calai.nutrilabel.nutrient.reconcile.ReconcileSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/nutrients")
public class NutrientReconcileController {

    private final NutrientReconciliationJob job;

    /**
     * ✅ fatal 失敗仍回 summary（500），方便看做到哪裡
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileSummary> reconcile(@Valid @RequestBody ReconcileRequest req) {
        ReconcileSummary summary = job.run(req);
        HttpStatus status = summary.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(summary);
    }
}
