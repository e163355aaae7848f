package com.calai.nutrilabel.label.controller;

import com.calai.nutrilabel.label.lineage.LineageNode;
import com.calai.nutrilabel.label.lineage.LineageTreeService;
import com.calai.nutrilabel.label.refresh.LabelRefreshJob;
import com.calai.nutrilabel.label.refresh.LabelRefreshRequest;
import com.calai.nutrilabel.label.refresh.LabelRefreshSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/labels")
public class LabelController {

    private final LabelRefreshJob refreshJob;
    private final LineageTreeService treeService;

    @PostMapping("/refresh")
    public ResponseEntity<LabelRefreshSummary> refresh(@Valid @RequestBody LabelRefreshRequest req) {
        LabelRefreshSummary summary = refreshJob.run(req);
        HttpStatus status = summary.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(summary);
    }

    @GetMapping("/{labelId}/lineage")
    public LineageNode lineage(@PathVariable String labelId) {
        return treeService.buildTree(labelId);
    }
}
