package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.entity.LabelLineageEdgeEntity;
import com.calai.nutrilabel.label.entity.LabelSnapshotEntity;
import com.calai.nutrilabel.label.entity.LabelType;
import com.calai.nutrilabel.label.entity.LineageEdgeType;
import com.calai.nutrilabel.label.repo.LabelLineageEdgeRepository;
import com.calai.nutrilabel.label.repo.LabelSnapshotRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * snapshot / edge 只新增
 */
@Component
@RequiredArgsConstructor
public class LabelSnapshotWriter {

    private final LabelSnapshotRepository snapshotRepo;
    private final LabelLineageEdgeRepository edgeRepo;

    public LabelSnapshotEntity insert(String organizationId,
                                      LabelType labelType,
                                      String externalRefId,
                                      String title,
                                      JsonNode payload,
                                      String createdBy,
                                      Instant frozenAt) {
        long existing = snapshotRepo.countByOrganizationIdAndLabelTypeAndExternalRefId(organizationId, labelType, externalRefId);

        LabelSnapshotEntity s = new LabelSnapshotEntity();
        s.setOrganizationId(organizationId);
        s.setLabelType(labelType);
        s.setExternalRefId(externalRefId);
        s.setTitle(title);
        s.setPayload(payload);
        s.setVersion(Math.toIntExact(existing + 1));
        s.setFrozenAt(frozenAt);
        s.setCreatedBy(createdBy);
        return snapshotRepo.saveAndFlush(s);
    }

    public LabelLineageEdgeEntity link(LabelSnapshotEntity parent, LabelSnapshotEntity child, LineageEdgeType edgeType) {
        if (parent.getLabelType() != edgeType.parentType() || child.getLabelType() != edgeType.childType()) {
            throw new IllegalArgumentException("edge " + edgeType + " cannot link "
                                               + parent.getLabelType() + " -> " + child.getLabelType());
        }
        LabelLineageEdgeEntity e = new LabelLineageEdgeEntity();
        e.setParentLabelId(parent.getId());
        e.setChildLabelId(child.getId());
        e.setEdgeType(edgeType);
        return edgeRepo.save(e);
    }
}
