package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.entity.LabelType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record LineageNode(
        String labelId,
        LabelType labelType,
        String title,
        int version,
        boolean provisional,
        JsonNode evidenceSummary,
        List<LineageNode> children
) {}
