package com.calai.nutrilabel.label.lineage;

import com.calai.nutrilabel.label.entity.LabelLineageEdgeEntity;
import com.calai.nutrilabel.label.entity.LabelSnapshotEntity;
import com.calai.nutrilabel.label.repo.LabelLineageEdgeRepository;
import com.calai.nutrilabel.label.repo.LabelSnapshotRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * snapshot → 子樹（DFS，每個節點只走一次）
 */
@Service
@RequiredArgsConstructor
public class LineageTreeService {

    private static final Comparator<LineageNode> CHILD_ORDER = Comparator
            .comparing(LineageNode::labelType)
            .thenComparing(LineageNode::title, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(LineageNode::labelId);

    private final LabelSnapshotRepository snapshotRepo;
    private final LabelLineageEdgeRepository edgeRepo;

    /**
     * @throws NoSuchElementException labelId 不存在
     */
    @Transactional(readOnly = true)
    public LineageNode buildTree(String labelId) {
        if (!snapshotRepo.existsById(labelId)) {
            throw new NoSuchElementException("LABEL_NOT_FOUND: " + labelId);
        }
        return walk(labelId, new HashSet<>()).orElseThrow();
    }

    private Optional<LineageNode> walk(String labelId, Set<String> visited) {
        if (!visited.add(labelId)) return Optional.empty();

        Optional<LabelSnapshotEntity> found = snapshotRepo.findById(labelId);
        if (found.isEmpty()) return Optional.empty();
        LabelSnapshotEntity snap = found.get();

        List<LineageNode> children = new ArrayList<>();
        for (LabelLineageEdgeEntity edge : edgeRepo.findByParentLabelId(labelId)) {
            walk(edge.getChildLabelId(), visited).ifPresent(children::add);
        }
        children.sort(CHILD_ORDER);

        JsonNode payload = snap.getPayload();
        JsonNode evidence = payload == null ? null : payload.get("evidenceSummary");
        boolean provisional = payload != null && payload.path("provisional").asBoolean(false);

        return Optional.of(new LineageNode(
                snap.getId(),
                snap.getLabelType(),
                snap.getTitle(),
                snap.getVersion(),
                provisional,
                evidence,
                List.copyOf(children)
        ));
    }
}
