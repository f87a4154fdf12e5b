package com.tracegroup.engine.heuristic;

import com.tracegroup.core.model.StatType;
import com.tracegroup.core.model.StatValue;
import com.tracegroup.engine.forest.EventForest;
import com.tracegroup.engine.forest.EventNode;
import com.tracegroup.engine.forest.GroupMetadata;

import java.util.Optional;

/**
 * Copies the model id of inference requests into group metadata.
 * Labels only; group membership is unchanged.
 */
public class ModelIdTagger {

    private final StatType modelIdStat;

    public ModelIdTagger(StatType modelIdStat) {
        this.modelIdStat = modelIdStat;
    }

    /**
     * @return number of groups tagged
     */
    public int tag(EventForest forest) {
        int tagged = 0;
        for (GroupMetadata metadata : forest.groupMetadataMap().values()) {
            Optional<EventNode> root = forest.groupRoot(metadata.groupId());
            if (root.isEmpty()) {
                continue;
            }
            Optional<StatValue> modelId = forest.contextStat(root.get(), modelIdStat);
            if (modelId.isEmpty()) {
                continue;
            }
            metadata.setModelId(modelId.get().asString());
            if (root.get().event().stat(modelIdStat).isEmpty()) {
                root.get().event().setStat(modelIdStat, modelId.get());
            }
            tagged++;
        }
        return tagged;
    }
}
